package org.nowstart.lending.data.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigInteger;

public record AmountRequest(
        @NotNull(message = "amount is required")
        @Positive(message = "amount must be greater than zero")
        BigInteger amount
) {
}
