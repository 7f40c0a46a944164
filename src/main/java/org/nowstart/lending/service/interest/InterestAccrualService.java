package org.nowstart.lending.service.interest;

import java.math.BigInteger;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.lending.data.dto.InterestDueDto;
import org.nowstart.lending.data.entity.InterestSchedule;
import org.nowstart.lending.data.entity.InterestState;
import org.nowstart.lending.data.entity.InterestVault;
import org.nowstart.lending.data.entity.VaultSettings;
import org.nowstart.lending.data.exception.LendingException;
import org.nowstart.lending.data.property.LendingProperties;
import org.nowstart.lending.data.type.LendingErrorCode;
import org.nowstart.lending.data.type.Permission;
import org.nowstart.lending.repository.InterestScheduleRepository;
import org.nowstart.lending.repository.InterestStateRepository;
import org.nowstart.lending.repository.InterestVaultRepository;
import org.nowstart.lending.service.audit.AuditEventService;
import org.nowstart.lending.service.auth.AccessControlService;
import org.nowstart.lending.service.chain.BlockClock;
import org.nowstart.lending.service.math.FixedPointMath;
import org.nowstart.lending.service.token.TokenGateway;
import org.nowstart.lending.service.vault.TreasuryService;
import org.nowstart.lending.service.vault.VaultSettingsService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Discretized simple interest per (vault, position). Interest is charged only for whole
 * periods of {@code periodBlocks}; the remainder of a partial period is dropped, not carried.
 * Compounding happens across calls because each charge is folded into the position's debt.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InterestAccrualService {

    private final InterestVaultRepository interestVaultRepository;
    private final InterestStateRepository interestStateRepository;
    private final InterestScheduleRepository interestScheduleRepository;
    private final TreasuryService treasuryService;
    private final VaultSettingsService vaultSettingsService;
    private final TokenGateway tokenGateway;
    private final AccessControlService accessControlService;
    private final AuditEventService auditEventService;
    private final BlockClock blockClock;
    private final LendingProperties lendingProperties;

    @Transactional
    public void registerVault(String caller, String vault, int annualRateBips) {
        accessControlService.require(caller, Permission.ADMIN);
        if (vault == null || vault.isBlank()) {
            throw new LendingException(LendingErrorCode.INVALID_ADDRESS, "Vault address is required");
        }
        if (annualRateBips <= 0) {
            throw new LendingException(LendingErrorCode.INVALID_RATE, "annualRateBips must be greater than zero");
        }
        if (interestVaultRepository.existsById(vault)) {
            throw new LendingException(LendingErrorCode.VAULT_ALREADY_REGISTERED, "Vault " + vault + " is already registered");
        }
        register(caller, vault, annualRateBips);
    }

    /**
     * Registers the configured vault at start-up unless a rate is already on record.
     */
    @Transactional
    public boolean registerConfiguredVault(String vault, int annualRateBips) {
        if (annualRateBips <= 0 || interestVaultRepository.existsById(vault)) {
            return false;
        }
        register("bootstrap", vault, annualRateBips);
        return true;
    }

    @Transactional
    public void updateVaultRate(String caller, String vault, int annualRateBips) {
        accessControlService.require(caller, Permission.ADMIN);
        if (annualRateBips <= 0) {
            throw new LendingException(LendingErrorCode.INVALID_RATE, "annualRateBips must be greater than zero");
        }
        InterestVault interestVault = interestVaultRepository.findById(vault)
                .orElseThrow(() -> new LendingException(LendingErrorCode.VAULT_NOT_REGISTERED, "Vault " + vault + " is not registered"));

        int previous = interestVault.getAnnualRateBips();
        interestVault.setAnnualRateBips(annualRateBips);
        interestVaultRepository.save(interestVault);
        auditEventService.record("ADMIN_INTEREST_RATE_UPDATED", caller, "vault=" + vault + " old=" + previous + " new=" + annualRateBips);
        log.info("event=admin_update field=annual_rate_bips vault={} old={} new={}", vault, previous, annualRateBips);
    }

    @Transactional
    public void updatePeriodBlocks(String caller, long periodBlocks) {
        accessControlService.require(caller, Permission.ADMIN);
        if (periodBlocks <= 0) {
            throw new LendingException(LendingErrorCode.INVALID_CONFIGURATION, "periodBlocks must be greater than zero");
        }
        InterestSchedule schedule = schedule();
        long previous = schedule.getPeriodBlocks();
        schedule.setPeriodBlocks(periodBlocks);
        schedule.setPeriodShare(periodShare(periodBlocks, schedule.getBlocksPerYear()));
        interestScheduleRepository.save(schedule);
        auditEventService.record("ADMIN_PERIOD_BLOCKS_UPDATED", caller, "old=" + previous + " new=" + periodBlocks);
        log.info("event=admin_update field=period_blocks old={} new={} period_share={}", previous, periodBlocks, schedule.getPeriodShare());
    }

    @Transactional
    public InterestSchedule schedule() {
        return interestScheduleRepository.findById(InterestSchedule.DEFAULT_ID)
                .orElseGet(() -> {
                    LendingProperties.Interest interest = lendingProperties.interest();
                    return interestScheduleRepository.save(InterestSchedule.builder()
                            .id(InterestSchedule.DEFAULT_ID)
                            .periodBlocks(interest.periodBlocks())
                            .blocksPerYear(interest.blocksPerYear())
                            .periodShare(periodShare(interest.periodBlocks(), interest.blocksPerYear()))
                            .build());
                });
    }

    public boolean isRegistered(String vault) {
        return interestVaultRepository.existsById(vault);
    }

    /**
     * Starts (or restarts) accrual for a position from the current block. Block 0 is the
     * dormant marker, so a position activated there is anchored at block 1.
     */
    @Transactional
    public void activate(String vault, Long positionId) {
        InterestState state = loadState(vault, positionId);
        state.setLastCollectionBlock(Math.max(blockClock.currentBlock(), InterestState.INACTIVE + 1));
        interestStateRepository.save(state);
    }

    /**
     * Puts a position back to the dormant state after it is closed or liquidated. The row is kept.
     */
    @Transactional
    public void deactivate(String vault, Long positionId) {
        interestStateRepository.findById(new InterestState.InterestStateKey(vault, positionId))
                .ifPresent(state -> {
                    state.setLastCollectionBlock(InterestState.INACTIVE);
                    interestStateRepository.save(state);
                });
    }

    @Transactional(readOnly = true)
    public boolean isActive(String vault, Long positionId) {
        return interestStateRepository.findById(new InterestState.InterestStateKey(vault, positionId))
                .map(InterestState::isActive)
                .orElse(false);
    }

    @Transactional(readOnly = true)
    public BigInteger calculateInterestDue(String vault, Long positionId, BigInteger debtAmount) {
        if (debtAmount == null || debtAmount.signum() <= 0) {
            return BigInteger.ZERO;
        }
        Optional<InterestVault> interestVault = interestVaultRepository.findById(vault);
        if (interestVault.isEmpty()) {
            return BigInteger.ZERO;
        }
        Optional<InterestState> state = interestStateRepository.findById(new InterestState.InterestStateKey(vault, positionId));
        if (state.isEmpty() || !state.get().isActive()) {
            return BigInteger.ZERO;
        }

        InterestSchedule schedule = schedule();
        long periodsPassed = periodsPassed(state.get().getLastCollectionBlock(), schedule.getPeriodBlocks());
        if (periodsPassed == 0) {
            return BigInteger.ZERO;
        }

        return debtAmount
                .multiply(BigInteger.valueOf(interestVault.get().getAnnualRateBips()))
                .multiply(schedule.getPeriodShare())
                .multiply(BigInteger.valueOf(periodsPassed))
                .divide(FixedPointMath.BIPS.multiply(FixedPointMath.PRECISION));
    }

    /**
     * Charges the interest due on {@code debtAmount} and returns it so the calling vault can add
     * it to the position's debt. Returns zero without touching state while no whole period has
     * passed since the last collection.
     */
    @Transactional
    public BigInteger collectInterest(String caller, String vault, String token, Long positionId, BigInteger debtAmount) {
        if (caller == null || !caller.equals(vault)) {
            throw new LendingException(LendingErrorCode.VAULT_NOT_CALLER, "Only vault " + vault + " may collect its interest");
        }
        if (!interestVaultRepository.existsById(vault)) {
            throw new LendingException(LendingErrorCode.VAULT_NOT_REGISTERED, "Vault " + vault + " is not registered");
        }

        InterestState state = loadState(vault, positionId);
        if (!state.isActive()) {
            return BigInteger.ZERO;
        }
        long periodsPassed = periodsPassed(state.getLastCollectionBlock(), schedule().getPeriodBlocks());
        if (periodsPassed == 0) {
            return BigInteger.ZERO;
        }

        BigInteger interest = calculateInterestDue(vault, positionId, debtAmount);
        if (interest.signum() == 0) {
            throw new LendingException(
                    LendingErrorCode.NO_INTEREST_TO_COLLECT,
                    "No interest to collect for position " + positionId + " with debt " + debtAmount
            );
        }

        long currentBlock = blockClock.currentBlock();
        state.setLastCollectionBlock(currentBlock);
        state.setTotalCollected(state.getTotalCollected().add(interest));
        interestStateRepository.save(state);
        treasuryService.addInterest(token, interest);

        log.info(
                "event=interest_collected vault={} position_id={} token={} debt={} interest={} periods={} block={}",
                vault,
                positionId,
                token,
                debtAmount,
                interest,
                periodsPassed,
                currentBlock
        );
        return interest;
    }

    @Transactional(readOnly = true)
    public InterestDueDto describe(String vault, Long positionId, BigInteger debtAmount) {
        long lastCollectionBlock = interestStateRepository.findById(new InterestState.InterestStateKey(vault, positionId))
                .map(InterestState::getLastCollectionBlock)
                .orElse(InterestState.INACTIVE);
        return new InterestDueDto(
                vault,
                positionId,
                debtAmount,
                calculateInterestDue(vault, positionId, debtAmount),
                lastCollectionBlock,
                blockClock.currentBlock()
        );
    }

    /**
     * Pays the collected interest pool of {@code token} out to the configured treasury.
     */
    @Transactional
    public BigInteger withdrawTreasury(String caller, String token) {
        accessControlService.require(caller, Permission.ADMIN);
        VaultSettings settings = vaultSettingsService.current();
        if (!settings.getDebtAsset().equals(token)) {
            throw new LendingException(LendingErrorCode.INVALID_ASSET, "Interest is only collected in " + settings.getDebtAsset());
        }

        BigInteger amount = treasuryService.drainPendingInterest(token);
        if (amount.signum() > 0) {
            tokenGateway.mint(token, settings.getTreasury(), amount);
        }
        auditEventService.record("TREASURY_WITHDRAWN", caller, "token=" + token + " amount=" + amount + " to=" + settings.getTreasury());
        log.info("event=treasury_withdrawn token={} amount={} treasury={}", token, amount, settings.getTreasury());
        return amount;
    }

    private void register(String actor, String vault, int annualRateBips) {
        interestVaultRepository.save(InterestVault.builder()
                .vaultAddress(vault)
                .annualRateBips(annualRateBips)
                .build());
        auditEventService.record("INTEREST_VAULT_REGISTERED", actor, "vault=" + vault + " annualRateBips=" + annualRateBips);
        log.info("event=interest_vault_registered vault={} annual_rate_bips={}", vault, annualRateBips);
    }

    private long periodsPassed(long lastCollectionBlock, long periodBlocks) {
        long blocksPassed = blockClock.currentBlock() - lastCollectionBlock;
        if (blocksPassed <= 0) {
            return 0;
        }
        return blocksPassed / periodBlocks;
    }

    private InterestState loadState(String vault, Long positionId) {
        InterestState.InterestStateKey key = new InterestState.InterestStateKey(vault, positionId);
        return interestStateRepository.findById(key)
                .orElseGet(() -> InterestState.builder()
                        .id(key)
                        .lastCollectionBlock(InterestState.INACTIVE)
                        .totalCollected(BigInteger.ZERO)
                        .build());
    }

    static BigInteger periodShare(long periodBlocks, long blocksPerYear) {
        return BigInteger.valueOf(periodBlocks)
                .multiply(FixedPointMath.PRECISION)
                .divide(BigInteger.valueOf(blocksPerYear));
    }
}
