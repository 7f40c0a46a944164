package org.nowstart.lending.service.vault;

import java.math.BigInteger;
import lombok.RequiredArgsConstructor;
import org.nowstart.lending.data.dto.TreasuryPoolDto;
import org.nowstart.lending.data.entity.TreasuryPool;
import org.nowstart.lending.repository.TreasuryPoolRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per debt-asset accumulator of collected interest and of debt written off by liquidations.
 */
@Service
@RequiredArgsConstructor
public class TreasuryService {

    private final TreasuryPoolRepository treasuryPoolRepository;

    @Transactional
    public TreasuryPool addInterest(String token, BigInteger amount) {
        TreasuryPool pool = load(token);
        pool.setPendingInterest(pool.getPendingInterest().add(amount));
        return treasuryPoolRepository.save(pool);
    }

    @Transactional
    public TreasuryPool absorbLoss(String token, BigInteger amount) {
        TreasuryPool pool = load(token);
        pool.setAbsorbedLoss(pool.getAbsorbedLoss().add(amount));
        return treasuryPoolRepository.save(pool);
    }

    /**
     * Moves the whole pending amount to withdrawn and returns it.
     */
    @Transactional
    public BigInteger drainPendingInterest(String token) {
        TreasuryPool pool = load(token);
        BigInteger pending = pool.getPendingInterest();
        if (pending.signum() == 0) {
            return BigInteger.ZERO;
        }
        pool.setPendingInterest(BigInteger.ZERO);
        pool.setWithdrawnInterest(pool.getWithdrawnInterest().add(pending));
        treasuryPoolRepository.save(pool);
        return pending;
    }

    @Transactional(readOnly = true)
    public TreasuryPoolDto get(String token) {
        TreasuryPool pool = treasuryPoolRepository.findById(token).orElseGet(() -> TreasuryPool.empty(token));
        return new TreasuryPoolDto(
                pool.getToken(),
                pool.getPendingInterest(),
                pool.getWithdrawnInterest(),
                pool.getAbsorbedLoss()
        );
    }

    private TreasuryPool load(String token) {
        return treasuryPoolRepository.findById(token).orElseGet(() -> TreasuryPool.empty(token));
    }
}
