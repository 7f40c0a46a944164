package org.nowstart.lending.service.chain;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.nowstart.lending.data.property.LendingProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Derives block height from elapsed time since a configured genesis at a fixed block time.
 * Block 1 is the first block after genesis so that 0 stays free as the "never charged" marker.
 */
@Component
public class WallClockBlockClock implements BlockClock {

    private final Clock clock;
    private final Instant genesis;
    private final long blockMillis;

    @Autowired
    public WallClockBlockClock(LendingProperties lendingProperties) {
        this(Clock.systemUTC(), lendingProperties.chain().genesis(), lendingProperties.chain().blockTime());
    }

    WallClockBlockClock(Clock clock, Instant genesis, Duration blockTime) {
        if (blockTime.isZero() || blockTime.isNegative()) {
            throw new IllegalArgumentException("blockTime must be positive");
        }
        this.clock = clock;
        this.genesis = genesis;
        this.blockMillis = blockTime.toMillis();
    }

    @Override
    public long currentBlock() {
        long elapsed = Duration.between(genesis, clock.instant()).toMillis();
        if (elapsed < 0) {
            return 1L;
        }
        return elapsed / blockMillis + 1L;
    }

    @Override
    public Instant now() {
        return clock.instant();
    }
}
