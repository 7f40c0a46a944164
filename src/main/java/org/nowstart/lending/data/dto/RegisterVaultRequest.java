package org.nowstart.lending.data.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record RegisterVaultRequest(
        @NotBlank(message = "vault is required")
        String vault,
        @Positive(message = "annualRateBips must be greater than zero")
        int annualRateBips
) {
}
