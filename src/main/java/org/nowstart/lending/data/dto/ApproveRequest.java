package org.nowstart.lending.data.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;

public record ApproveRequest(
        @NotBlank(message = "token is required")
        String token,
        @NotBlank(message = "spender is required")
        String spender,
        @NotNull(message = "amount is required")
        @PositiveOrZero(message = "amount must not be negative")
        BigInteger amount
) {
}
