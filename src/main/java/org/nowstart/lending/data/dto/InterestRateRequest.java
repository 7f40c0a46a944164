package org.nowstart.lending.data.dto;

import jakarta.validation.constraints.Positive;

public record InterestRateRequest(
        @Positive(message = "annualRateBips must be greater than zero")
        int annualRateBips
) {
}
