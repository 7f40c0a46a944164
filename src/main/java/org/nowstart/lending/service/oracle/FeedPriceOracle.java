package org.nowstart.lending.service.oracle;

import java.math.BigInteger;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.nowstart.lending.data.dto.PriceFeedResponse;
import org.nowstart.lending.data.exception.LendingException;
import org.nowstart.lending.data.type.LendingErrorCode;
import org.nowstart.lending.repository.PriceFeedFeignClient;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class FeedPriceOracle implements PriceOracle {

    private final PriceFeedFeignClient priceFeedFeignClient;

    @Override
    public OracleReading latestPrice(String feedId) {
        PriceFeedResponse response = priceFeedFeignClient.getLatest(feedId);
        if (response == null || response.price() == null || response.decimals() == null || response.updatedAt() == null) {
            throw new LendingException(LendingErrorCode.INVALID_PRICE, "Incomplete price feed response for feed=" + feedId);
        }
        return new OracleReading(
                parsePrice(feedId, response.price()),
                response.decimals(),
                Instant.ofEpochSecond(response.updatedAt())
        );
    }

    private BigInteger parsePrice(String feedId, String value) {
        try {
            return new BigInteger(value.trim());
        } catch (NumberFormatException e) {
            throw new LendingException(LendingErrorCode.INVALID_PRICE, "Unparsable price for feed=" + feedId, e);
        }
    }
}
