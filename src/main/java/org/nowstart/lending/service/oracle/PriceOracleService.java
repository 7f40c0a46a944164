package org.nowstart.lending.service.oracle;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.lending.data.exception.LendingException;
import org.nowstart.lending.data.property.LendingProperties;
import org.nowstart.lending.data.type.LendingErrorCode;
import org.nowstart.lending.service.chain.BlockClock;
import org.nowstart.lending.service.math.FixedPointMath;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class PriceOracleService {

    private static final int MAX_FEED_DECIMALS = 36;

    private final PriceOracle priceOracle;
    private final BlockClock blockClock;
    private final LendingProperties lendingProperties;

    /**
     * Reads the feed and rejects non-positive or stale prices. Never cached: every call hits
     * the oracle again.
     */
    public PriceQuote priceOf(String feedId) {
        if (feedId == null || feedId.isBlank()) {
            throw new LendingException(LendingErrorCode.PRICE_FEED_NOT_CONFIGURED, "Price feed is not configured");
        }

        OracleReading reading = priceOracle.latestPrice(feedId);
        if (reading == null || reading.price() == null || reading.price().signum() <= 0) {
            throw new LendingException(LendingErrorCode.INVALID_PRICE, "Oracle returned a non-positive price for feed=" + feedId);
        }
        if (reading.decimals() < 0 || reading.decimals() > MAX_FEED_DECIMALS) {
            throw new LendingException(LendingErrorCode.INVALID_PRICE, "Oracle returned unsupported decimals for feed=" + feedId);
        }

        Instant now = blockClock.now();
        Duration staleness = lendingProperties.oracle().staleness();
        if (reading.updatedAt() == null || reading.updatedAt().plus(staleness).isBefore(now)) {
            log.warn("event=stale_price feed={} updated_at={} now={} staleness={}", feedId, reading.updatedAt(), now, staleness);
            throw new LendingException(LendingErrorCode.STALE_PRICE, "Price for feed=" + feedId + " is older than " + staleness);
        }

        BigInteger normalized = FixedPointMath.normalizePrice(reading.price(), reading.decimals());
        if (normalized.signum() <= 0) {
            throw new LendingException(LendingErrorCode.INVALID_PRICE, "Oracle price rounds to zero at 18 decimals for feed=" + feedId);
        }
        return new PriceQuote(feedId, normalized, reading.updatedAt());
    }
}
