package org.nowstart.lending.data.dto;

public record PriceFeedResponse(
        String feedId,
        String price,
        Integer decimals,
        Long updatedAt
) {
}
