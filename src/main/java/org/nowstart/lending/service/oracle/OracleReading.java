package org.nowstart.lending.service.oracle;

import java.math.BigInteger;
import java.time.Instant;

public record OracleReading(
        BigInteger price,
        int decimals,
        Instant updatedAt
) {
}
