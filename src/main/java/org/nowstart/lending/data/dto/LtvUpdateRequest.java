package org.nowstart.lending.data.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;

public record LtvUpdateRequest(
        @Min(value = 1, message = "ltvRatio must be at least 1")
        @Max(value = 100, message = "ltvRatio must be at most 100")
        int ltvRatio,
        @Positive(message = "liquidationThreshold must be greater than zero")
        int liquidationThreshold
) {
}
