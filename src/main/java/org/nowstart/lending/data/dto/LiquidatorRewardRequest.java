package org.nowstart.lending.data.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public record LiquidatorRewardRequest(
        @Min(value = 0, message = "liquidatorRewardBips must not be negative")
        @Max(value = 10000, message = "liquidatorRewardBips must be at most 10000")
        int liquidatorRewardBips
) {
}
