package org.nowstart.lending.scheduler;

import java.math.BigInteger;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.lending.data.entity.LoanPosition;
import org.nowstart.lending.data.exception.LendingException;
import org.nowstart.lending.data.property.LendingProperties;
import org.nowstart.lending.data.type.PositionStatus;
import org.nowstart.lending.repository.LoanPositionRepository;
import org.nowstart.lending.service.ledger.PositionLedgerService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class InterestCollectionScheduler {

    private final LoanPositionRepository loanPositionRepository;
    private final PositionLedgerService positionLedgerService;
    private final LendingProperties lendingProperties;

    @Scheduled(fixedDelayString = "${lending.interest.collection-interval:60s}")
    public void run() {
        if (!lendingProperties.interest().enabled()) {
            return;
        }

        List<LoanPosition> positions = loanPositionRepository
                .findByStatusAndDebtAmountGreaterThanOrderByIdAsc(PositionStatus.OPEN, BigInteger.ZERO);
        int charged = 0;
        int failed = 0;
        BigInteger total = BigInteger.ZERO;
        for (LoanPosition position : positions) {
            try {
                BigInteger interest = positionLedgerService.chargeInterest(position.getId());
                if (interest.signum() > 0) {
                    charged++;
                    total = total.add(interest);
                }
            } catch (LendingException e) {
                failed++;
                log.warn("Skipping interest collection. position_id={}, code={}, reason={}", position.getId(), e.getCode(), e.getMessage());
            } catch (Exception e) {
                failed++;
                log.error("Failed to collect interest. position_id={}", position.getId(), e);
            }
        }

        log.info(
                "event=interest_collection_cycle positions={} charged={} failed={} total_interest={}",
                positions.size(),
                charged,
                failed,
                total
        );
    }
}
