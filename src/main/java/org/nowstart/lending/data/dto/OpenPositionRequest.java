package org.nowstart.lending.data.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;

public record OpenPositionRequest(
        @NotBlank(message = "collateralAsset is required")
        String collateralAsset,
        @NotNull(message = "collateralAmount is required")
        @Positive(message = "collateralAmount must be greater than zero")
        BigInteger collateralAmount,
        @PositiveOrZero(message = "debtAmount must not be negative")
        BigInteger debtAmount,
        @Positive(message = "leverage must be greater than zero")
        Integer leverage
) {
}
