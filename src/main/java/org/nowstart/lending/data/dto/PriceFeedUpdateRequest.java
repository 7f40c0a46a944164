package org.nowstart.lending.data.dto;

import jakarta.validation.constraints.NotBlank;

public record PriceFeedUpdateRequest(
        @NotBlank(message = "asset is required")
        String asset,
        @NotBlank(message = "feedId is required")
        String feedId
) {
}
