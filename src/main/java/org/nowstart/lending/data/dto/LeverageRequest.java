package org.nowstart.lending.data.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;
import java.util.List;

public record LeverageRequest(
        @NotNull(message = "collateralAmount is required")
        @Positive(message = "collateralAmount must be greater than zero")
        BigInteger collateralAmount,
        @NotNull(message = "leverage is required")
        Integer leverage,
        @PositiveOrZero(message = "minAmountOut must not be negative")
        BigInteger minAmountOut,
        // optional token path overriding the configured swap route
        List<String> swapRoute
) {
}
