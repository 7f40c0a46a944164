package org.nowstart.lending.data.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigInteger;

public record BorrowForRequest(
        @NotBlank(message = "beneficiary is required")
        String beneficiary,
        @NotNull(message = "amount is required")
        @Positive(message = "amount must be greater than zero")
        BigInteger amount
) {
}
