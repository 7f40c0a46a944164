package org.nowstart.lending.service.chain;

import java.time.Instant;

/**
 * Source of the current block height and wall time used for interest periods and price
 * staleness.
 */
public interface BlockClock {

    long currentBlock();

    Instant now();
}
