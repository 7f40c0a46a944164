package org.nowstart.lending.data.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigInteger;

public record MintRequest(
        @NotBlank(message = "token is required")
        String token,
        @NotBlank(message = "to is required")
        String to,
        @NotNull(message = "amount is required")
        @Positive(message = "amount must be greater than zero")
        BigInteger amount
) {
}
