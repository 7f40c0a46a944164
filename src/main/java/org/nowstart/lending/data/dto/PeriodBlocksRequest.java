package org.nowstart.lending.data.dto;

import jakarta.validation.constraints.Positive;

public record PeriodBlocksRequest(
        @Positive(message = "periodBlocks must be greater than zero")
        long periodBlocks
) {
}
