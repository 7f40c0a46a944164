package org.nowstart.lending.service.oracle;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Oracle price validated for freshness and scaled to 18 decimals.
 */
public record PriceQuote(
        String feedId,
        BigInteger price,
        Instant updatedAt
) {
}
