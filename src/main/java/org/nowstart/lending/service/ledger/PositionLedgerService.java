package org.nowstart.lending.service.ledger;

import java.math.BigInteger;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.lending.data.dto.LiquidationResultDto;
import org.nowstart.lending.data.dto.PositionDto;
import org.nowstart.lending.data.dto.PositionHealthDto;
import org.nowstart.lending.data.dto.UserBalanceDto;
import org.nowstart.lending.data.entity.LoanPosition;
import org.nowstart.lending.data.entity.UserBalance;
import org.nowstart.lending.data.entity.VaultSettings;
import org.nowstart.lending.data.exception.LendingException;
import org.nowstart.lending.data.property.LendingProperties;
import org.nowstart.lending.data.type.LendingErrorCode;
import org.nowstart.lending.data.type.Permission;
import org.nowstart.lending.data.type.PositionStatus;
import org.nowstart.lending.repository.LoanPositionRepository;
import org.nowstart.lending.repository.UserBalanceRepository;
import org.nowstart.lending.service.audit.AuditEventService;
import org.nowstart.lending.service.auth.AccessControlService;
import org.nowstart.lending.service.interest.InterestAccrualService;
import org.nowstart.lending.service.math.FixedPointMath;
import org.nowstart.lending.service.oracle.PriceOracleService;
import org.nowstart.lending.service.token.TokenGateway;
import org.nowstart.lending.service.vault.TreasuryService;
import org.nowstart.lending.service.vault.VaultSettingsService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Collateral and debt bookkeeping for every loan position of the vault.
 *
 * <p>Each mutating call holds the {@link LedgerGuard} for its whole body, charges interest before
 * it reads debt and re-reads oracle prices before it checks the LTV limit. Token movements run
 * in the same transaction, so a failure at any step leaves no partial effect behind.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionLedgerService {

    private final LoanPositionRepository loanPositionRepository;
    private final UserBalanceRepository userBalanceRepository;
    private final VaultSettingsService vaultSettingsService;
    private final PriceOracleService priceOracleService;
    private final InterestAccrualService interestAccrualService;
    private final TreasuryService treasuryService;
    private final TokenGateway tokenGateway;
    private final AccessControlService accessControlService;
    private final AuditEventService auditEventService;
    private final LedgerGuard ledgerGuard;
    private final LendingProperties lendingProperties;

    @Transactional
    public LoanPosition openPosition(
            String caller,
            String collateralAsset,
            BigInteger collateralAmount,
            BigInteger debtAmount,
            Integer leverageHint
    ) {
        try (LedgerGuard.Permit ignored = ledgerGuard.enter("openPosition")) {
            VaultSettings settings = vaultSettingsService.current();
            if (collateralAsset == null || !settings.getCollateralAsset().equals(collateralAsset)) {
                throw new LendingException(
                        LendingErrorCode.INVALID_ASSET,
                        "Collateral asset " + collateralAsset + " does not match " + settings.getCollateralAsset()
                );
            }
            return open(caller, caller, settings, collateralAmount, debtAmount, leverageHint);
        }
    }

    /**
     * Opens a position owned by {@code owner} with collateral funded by the calling leverage
     * account.
     */
    @Transactional
    public LoanPosition openPositionFor(
            String caller,
            String owner,
            BigInteger collateralAmount,
            BigInteger debtAmount,
            Integer leverageHint
    ) {
        try (LedgerGuard.Permit ignored = ledgerGuard.enter("openPositionFor")) {
            accessControlService.require(caller, Permission.LEVERAGE);
            requireAddress(owner, "owner");
            return open(caller, owner, vaultSettingsService.current(), collateralAmount, debtAmount, leverageHint);
        }
    }

    @Transactional
    public LoanPosition addCollateral(String caller, Long positionId, BigInteger amount) {
        try (LedgerGuard.Permit ignored = ledgerGuard.enter("addCollateral")) {
            LoanPosition position = loadOpen(positionId);
            accessControlService.requireOwnerOrDelegate(caller, position);
            FixedPointMath.requirePositive(amount, LendingErrorCode.INVALID_COLLATERAL_AMOUNT, "amount");

            VaultSettings settings = vaultSettingsService.current();
            chargeInterest(position, settings);
            tokenGateway.transferFrom(settings.getCollateralAsset(), settings.getVaultAddress(), caller, settings.getVaultAddress(), amount);

            position.setCollateralAmount(position.getCollateralAmount().add(amount));
            loanPositionRepository.save(position);
            adjustBalance(position.getOwner(), amount, BigInteger.ZERO);

            auditEventService.record("COLLATERAL_ADDED", caller, position.getId(), "amount=" + amount);
            log.info(
                    "event=collateral_added position_id={} caller={} amount={} collateral={}",
                    position.getId(),
                    caller,
                    amount,
                    position.getCollateralAmount()
            );
            return position;
        }
    }

    @Transactional
    public LoanPosition removeCollateral(String caller, Long positionId, BigInteger amount) {
        try (LedgerGuard.Permit ignored = ledgerGuard.enter("removeCollateral")) {
            LoanPosition position = loadOpen(positionId);
            accessControlService.requireOwner(caller, position);
            FixedPointMath.requirePositive(amount, LendingErrorCode.INVALID_AMOUNT, "amount");
            if (amount.compareTo(position.getCollateralAmount()) > 0) {
                throw new LendingException(
                        LendingErrorCode.INSUFFICIENT_COLLATERAL,
                        "Position " + positionId + " holds only " + position.getCollateralAmount()
                );
            }

            VaultSettings settings = vaultSettingsService.current();
            chargeInterest(position, settings);
            BigInteger remaining = position.getCollateralAmount().subtract(amount);
            if (position.hasDebt() && !withinLtv(remaining, position.getDebtAmount(), settings, prices(settings))) {
                throw new LendingException(
                        LendingErrorCode.INSUFFICIENT_COLLATERAL_AFTER_WITHDRAWAL,
                        "Remaining collateral " + remaining + " does not cover debt " + position.getDebtAmount()
                );
            }

            position.setCollateralAmount(remaining);
            loanPositionRepository.save(position);
            adjustBalance(position.getOwner(), amount.negate(), BigInteger.ZERO);
            tokenGateway.transfer(settings.getCollateralAsset(), settings.getVaultAddress(), caller, amount);

            auditEventService.record("COLLATERAL_REMOVED", caller, position.getId(), "amount=" + amount);
            log.info(
                    "event=collateral_removed position_id={} owner={} amount={} collateral={}",
                    position.getId(),
                    caller,
                    amount,
                    remaining
            );
            return position;
        }
    }

    @Transactional
    public LoanPosition borrow(String caller, Long positionId, BigInteger amount) {
        try (LedgerGuard.Permit ignored = ledgerGuard.enter("borrow")) {
            LoanPosition position = loadOpen(positionId);
            accessControlService.requireOwner(caller, position);
            return increaseDebt(caller, position, caller, amount);
        }
    }

    /**
     * Borrows against the position and mints the proceeds to {@code beneficiary} instead of the
     * caller.
     */
    @Transactional
    public LoanPosition borrowFor(String caller, Long positionId, String beneficiary, BigInteger amount) {
        try (LedgerGuard.Permit ignored = ledgerGuard.enter("borrowFor")) {
            LoanPosition position = loadOpen(positionId);
            accessControlService.requireOwnerOrDelegate(caller, position);
            requireAddress(beneficiary, "beneficiary");
            return increaseDebt(caller, position, beneficiary, amount);
        }
    }

    @Transactional
    public LoanPosition repay(String caller, Long positionId, BigInteger amount) {
        try (LedgerGuard.Permit ignored = ledgerGuard.enter("repay")) {
            requireAddress(caller, "caller");
            LoanPosition position = loadOpen(positionId);
            FixedPointMath.requirePositive(amount, LendingErrorCode.INVALID_AMOUNT, "amount");

            VaultSettings settings = vaultSettingsService.current();
            chargeInterest(position, settings);
            if (amount.compareTo(position.getDebtAmount()) > 0) {
                throw new LendingException(
                        LendingErrorCode.AMOUNT_EXCEEDS_LOAN,
                        "Repayment " + amount + " exceeds debt " + position.getDebtAmount()
                );
            }

            tokenGateway.burn(settings.getDebtAsset(), caller, amount);
            position.setDebtAmount(position.getDebtAmount().subtract(amount));
            loanPositionRepository.save(position);
            adjustBalance(position.getOwner(), BigInteger.ZERO, amount.negate());

            auditEventService.record("DEBT_REPAID", caller, position.getId(), "amount=" + amount);
            log.info(
                    "event=debt_repaid position_id={} payer={} amount={} debt={}",
                    position.getId(),
                    caller,
                    amount,
                    position.getDebtAmount()
            );
            return position;
        }
    }

    /**
     * Repays all outstanding debt from the owner, returns every unit of collateral and closes the
     * position for good.
     */
    @Transactional
    public LoanPosition closePosition(String caller, Long positionId) {
        try (LedgerGuard.Permit ignored = ledgerGuard.enter("closePosition")) {
            LoanPosition position = loadOpen(positionId);
            accessControlService.requireOwner(caller, position);

            VaultSettings settings = vaultSettingsService.current();
            chargeInterest(position, settings);
            BigInteger debt = position.getDebtAmount();
            BigInteger collateral = position.getCollateralAmount();
            if (debt.signum() > 0) {
                tokenGateway.burn(settings.getDebtAsset(), caller, debt);
            }
            if (collateral.signum() > 0) {
                tokenGateway.transfer(settings.getCollateralAsset(), settings.getVaultAddress(), caller, collateral);
            }

            position.setCollateralAmount(BigInteger.ZERO);
            position.setDebtAmount(BigInteger.ZERO);
            position.setStatus(PositionStatus.CLOSED);
            loanPositionRepository.save(position);
            adjustBalance(position.getOwner(), collateral.negate(), debt.negate());
            interestAccrualService.deactivate(settings.getVaultAddress(), position.getId());

            auditEventService.record("POSITION_CLOSED", caller, position.getId(), "repaid=" + debt + " returned=" + collateral);
            log.info(
                    "event=position_closed position_id={} owner={} repaid={} returned_collateral={}",
                    position.getId(),
                    caller,
                    debt,
                    collateral
            );
            return position;
        }
    }

    /**
     * Seizes all collateral of an unhealthy position. The liquidator receives its reward share and
     * the rest goes to the treasury. The written-off debt is booked as a treasury loss; debt asset
     * already in circulation is not burned.
     */
    @Transactional
    public LiquidationResultDto liquidate(String caller, Long positionId) {
        try (LedgerGuard.Permit ignored = ledgerGuard.enter("liquidate")) {
            requireAddress(caller, "caller");
            LoanPosition position = loadOpen(positionId);

            VaultSettings settings = vaultSettingsService.current();
            chargeInterest(position, settings);
            BigInteger health = position.hasDebt()
                    ? health(position.getCollateralAmount(), position.getDebtAmount(), settings, prices(settings))
                    : FixedPointMath.MAX_VALUE;
            if (!isLiquidatable(health, settings)) {
                log.warn(
                        "event=liquidation_rejected position_id={} liquidator={} health={} threshold={}",
                        position.getId(),
                        caller,
                        health,
                        settings.getLiquidationThreshold()
                );
                throw new LendingException(LendingErrorCode.POSITION_HEALTHY, "Position " + positionId + " is healthy");
            }

            BigInteger seized = position.getCollateralAmount();
            BigInteger writtenOff = position.getDebtAmount();
            BigInteger reward = FixedPointMath.mulDiv(seized, BigInteger.valueOf(settings.getLiquidatorRewardBips()), FixedPointMath.BIPS);
            BigInteger treasuryShare = seized.subtract(reward);
            if (reward.signum() > 0) {
                tokenGateway.transfer(settings.getCollateralAsset(), settings.getVaultAddress(), caller, reward);
            }
            if (treasuryShare.signum() > 0) {
                tokenGateway.transfer(settings.getCollateralAsset(), settings.getVaultAddress(), settings.getTreasury(), treasuryShare);
            }

            position.setCollateralAmount(BigInteger.ZERO);
            position.setDebtAmount(BigInteger.ZERO);
            position.setStatus(PositionStatus.LIQUIDATED);
            loanPositionRepository.save(position);
            adjustBalance(position.getOwner(), seized.negate(), writtenOff.negate());
            treasuryService.absorbLoss(settings.getDebtAsset(), writtenOff);
            interestAccrualService.deactivate(settings.getVaultAddress(), position.getId());

            auditEventService.record(
                    "POSITION_LIQUIDATED",
                    caller,
                    position.getId(),
                    "seized=" + seized + " reward=" + reward + " treasury=" + treasuryShare + " writtenOff=" + writtenOff
            );
            log.info(
                    "event=position_liquidated position_id={} owner={} liquidator={} seized={} reward={} treasury_share={} written_off={} health={}",
                    position.getId(),
                    position.getOwner(),
                    caller,
                    seized,
                    reward,
                    treasuryShare,
                    writtenOff,
                    health
            );
            return new LiquidationResultDto(position.getId(), caller, seized, reward, treasuryShare, writtenOff);
        }
    }

    /**
     * Folds the interest due on one position into its debt. Returns the charged amount, zero when
     * the position is not open or no whole period has passed.
     */
    @Transactional
    public BigInteger chargeInterest(Long positionId) {
        try (LedgerGuard.Permit ignored = ledgerGuard.enter("chargeInterest")) {
            LoanPosition position = load(positionId);
            if (!position.isOpen()) {
                return BigInteger.ZERO;
            }
            return chargeInterest(position, vaultSettingsService.current());
        }
    }

    @Transactional(readOnly = true)
    public LoanPosition getPosition(Long positionId) {
        return load(positionId);
    }

    @Transactional(readOnly = true)
    public List<LoanPosition> getPositionsByOwner(String owner) {
        return loanPositionRepository.findByOwnerOrderByIdAsc(owner);
    }

    /**
     * Health, capacity and liquidation state at current prices, counting interest due but not
     * charged yet.
     */
    @Transactional(readOnly = true)
    public PositionHealthDto getPositionHealth(Long positionId) {
        LoanPosition position = load(positionId);
        VaultSettings settings = vaultSettingsService.current();
        BigInteger debt = currentDebt(position, settings);
        Prices prices = prices(settings);

        BigInteger health = debt.signum() > 0
                ? health(position.getCollateralAmount(), debt, settings, prices)
                : FixedPointMath.MAX_VALUE;
        BigInteger maxDebt = maxDebt(position.getCollateralAmount(), settings, prices);
        return new PositionHealthDto(
                position.getId(),
                health,
                maxDebt,
                FixedPointMath.max(maxDebt.subtract(debt), BigInteger.ZERO),
                position.isOpen() && debt.signum() > 0 && isLiquidatable(health, settings)
        );
    }

    @Transactional(readOnly = true)
    public BigInteger getMaxBorrowable(Long positionId) {
        LoanPosition position = load(positionId);
        VaultSettings settings = vaultSettingsService.current();
        BigInteger maxDebt = maxDebt(position.getCollateralAmount(), settings, prices(settings));
        return FixedPointMath.max(maxDebt.subtract(currentDebt(position, settings)), BigInteger.ZERO);
    }

    /**
     * Total debt the position's collateral supports at current prices.
     */
    @Transactional(readOnly = true)
    public BigInteger getMaxDebt(Long positionId) {
        LoanPosition position = load(positionId);
        VaultSettings settings = vaultSettingsService.current();
        return maxDebt(position.getCollateralAmount(), settings, prices(settings));
    }

    @Transactional(readOnly = true)
    public BigInteger getCollateralBalance(String account) {
        return balanceOf(account).getCollateralBalance();
    }

    @Transactional(readOnly = true)
    public BigInteger getDebtBalance(String account) {
        return balanceOf(account).getDebtBalance();
    }

    @Transactional(readOnly = true)
    public UserBalanceDto getUserBalance(String account) {
        UserBalance balance = balanceOf(account);
        return new UserBalanceDto(account, balance.getCollateralBalance(), balance.getDebtBalance());
    }

    public PositionDto toDto(LoanPosition position) {
        return new PositionDto(
                position.getId(),
                position.getOwner(),
                position.getCollateralAmount(),
                position.getDebtAmount(),
                position.getStatus(),
                position.getLeverage()
        );
    }

    private LoanPosition open(
            String funder,
            String owner,
            VaultSettings settings,
            BigInteger collateralAmount,
            BigInteger debtAmount,
            Integer leverageHint
    ) {
        requireAddress(funder, "caller");
        FixedPointMath.requirePositive(collateralAmount, LendingErrorCode.INVALID_COLLATERAL_AMOUNT, "collateralAmount");
        BigInteger debt = FixedPointMath.orZero(debtAmount);
        if (debt.signum() < 0) {
            throw new LendingException(LendingErrorCode.INVALID_AMOUNT, "debtAmount must not be negative");
        }
        if (debt.signum() > 0 && !withinLtv(collateralAmount, debt, settings, prices(settings))) {
            throw new LendingException(
                    LendingErrorCode.LOAN_EXCEEDS_LTV_LIMIT,
                    "Debt " + debt + " exceeds the LTV limit of collateral " + collateralAmount
            );
        }

        tokenGateway.transferFrom(settings.getCollateralAsset(), settings.getVaultAddress(), funder, settings.getVaultAddress(), collateralAmount);
        LoanPosition position = loanPositionRepository.save(LoanPosition.builder()
                .owner(owner)
                .collateralAmount(collateralAmount)
                .debtAmount(debt)
                .status(PositionStatus.OPEN)
                .leverage(leverageHint == null ? 1 : leverageHint)
                .build());
        if (debt.signum() > 0) {
            tokenGateway.mint(settings.getDebtAsset(), funder, debt);
        }
        adjustBalance(owner, collateralAmount, debt);
        if (lendingProperties.interest().enabled()) {
            interestAccrualService.activate(settings.getVaultAddress(), position.getId());
        }

        auditEventService.record(
                "POSITION_OPENED",
                funder,
                position.getId(),
                "owner=" + owner + " collateral=" + collateralAmount + " debt=" + debt
        );
        log.info(
                "event=position_opened position_id={} owner={} funder={} collateral={} debt={} leverage={}",
                position.getId(),
                owner,
                funder,
                collateralAmount,
                debt,
                position.getLeverage()
        );
        return position;
    }

    private LoanPosition increaseDebt(String caller, LoanPosition position, String beneficiary, BigInteger amount) {
        FixedPointMath.requirePositive(amount, LendingErrorCode.INVALID_AMOUNT, "amount");
        VaultSettings settings = vaultSettingsService.current();
        chargeInterest(position, settings);

        BigInteger newDebt = position.getDebtAmount().add(amount);
        if (!withinLtv(position.getCollateralAmount(), newDebt, settings, prices(settings))) {
            throw new LendingException(
                    LendingErrorCode.LOAN_EXCEEDS_LTV_LIMIT,
                    "Debt " + newDebt + " exceeds the LTV limit of collateral " + position.getCollateralAmount()
            );
        }

        position.setDebtAmount(newDebt);
        loanPositionRepository.save(position);
        adjustBalance(position.getOwner(), BigInteger.ZERO, amount);
        if (lendingProperties.interest().enabled()
                && !interestAccrualService.isActive(settings.getVaultAddress(), position.getId())) {
            interestAccrualService.activate(settings.getVaultAddress(), position.getId());
        }
        tokenGateway.mint(settings.getDebtAsset(), beneficiary, amount);

        auditEventService.record("DEBT_BORROWED", caller, position.getId(), "amount=" + amount + " beneficiary=" + beneficiary);
        log.info(
                "event=debt_borrowed position_id={} caller={} beneficiary={} amount={} debt={}",
                position.getId(),
                caller,
                beneficiary,
                amount,
                newDebt
        );
        return position;
    }

    private BigInteger chargeInterest(LoanPosition position, VaultSettings settings) {
        if (!lendingProperties.interest().enabled()) {
            return BigInteger.ZERO;
        }
        String vault = settings.getVaultAddress();
        if (!position.hasDebt()) {
            // without debt the clock restarts, so a later borrow does not pay for idle blocks
            if (interestAccrualService.isActive(vault, position.getId())) {
                interestAccrualService.activate(vault, position.getId());
            }
            return BigInteger.ZERO;
        }
        if (interestAccrualService.calculateInterestDue(vault, position.getId(), position.getDebtAmount()).signum() == 0) {
            return BigInteger.ZERO;
        }

        BigInteger interest = interestAccrualService.collectInterest(
                vault,
                vault,
                settings.getDebtAsset(),
                position.getId(),
                position.getDebtAmount()
        );
        if (interest.signum() == 0) {
            return BigInteger.ZERO;
        }
        position.setDebtAmount(position.getDebtAmount().add(interest));
        loanPositionRepository.save(position);
        adjustBalance(position.getOwner(), BigInteger.ZERO, interest);
        auditEventService.record("INTEREST_CHARGED", vault, position.getId(), "interest=" + interest);
        return interest;
    }

    private BigInteger currentDebt(LoanPosition position, VaultSettings settings) {
        BigInteger due = interestAccrualService.calculateInterestDue(
                settings.getVaultAddress(),
                position.getId(),
                position.getDebtAmount()
        );
        return position.getDebtAmount().add(due);
    }

    private Prices prices(VaultSettings settings) {
        return new Prices(
                priceOracleService.priceOf(settings.getCollateralFeed()).price(),
                priceOracleService.priceOf(settings.getDebtFeed()).price()
        );
    }

    // debt * debtPrice * 100 * 10^colDec <= collateral * colPrice * ltv * 10^debtDec
    static boolean withinLtv(BigInteger collateral, BigInteger debt, VaultSettings settings, Prices prices) {
        BigInteger debtSide = debt
                .multiply(prices.debt())
                .multiply(FixedPointMath.PERCENT)
                .multiply(FixedPointMath.pow10(settings.getCollateralDecimals()));
        BigInteger collateralSide = collateral
                .multiply(prices.collateral())
                .multiply(BigInteger.valueOf(settings.getLtvRatio()))
                .multiply(FixedPointMath.pow10(settings.getDebtDecimals()));
        return debtSide.compareTo(collateralSide) <= 0;
    }

    static BigInteger maxDebt(BigInteger collateral, VaultSettings settings, Prices prices) {
        BigInteger numerator = collateral
                .multiply(prices.collateral())
                .multiply(BigInteger.valueOf(settings.getLtvRatio()))
                .multiply(FixedPointMath.pow10(settings.getDebtDecimals()));
        BigInteger denominator = prices.debt()
                .multiply(FixedPointMath.PERCENT)
                .multiply(FixedPointMath.pow10(settings.getCollateralDecimals()));
        return numerator.divide(denominator);
    }

    static BigInteger health(BigInteger collateral, BigInteger debt, VaultSettings settings, Prices prices) {
        BigInteger numerator = collateral
                .multiply(prices.collateral())
                .multiply(FixedPointMath.pow10(settings.getDebtDecimals()))
                .multiply(FixedPointMath.PRECISION);
        BigInteger denominator = debt
                .multiply(prices.debt())
                .multiply(FixedPointMath.pow10(settings.getCollateralDecimals()));
        return numerator.divide(denominator);
    }

    static boolean isLiquidatable(BigInteger health, VaultSettings settings) {
        BigInteger threshold = BigInteger.valueOf(settings.getLiquidationThreshold()).multiply(FixedPointMath.PRECISION);
        return health.multiply(FixedPointMath.PERCENT).compareTo(threshold) < 0;
    }

    private void adjustBalance(String owner, BigInteger collateralDelta, BigInteger debtDelta) {
        UserBalance balance = userBalanceRepository.findById(owner).orElseGet(() -> UserBalance.empty(owner));
        balance.setCollateralBalance(balance.getCollateralBalance().add(collateralDelta));
        balance.setDebtBalance(balance.getDebtBalance().add(debtDelta));
        userBalanceRepository.save(balance);
    }

    private UserBalance balanceOf(String account) {
        return userBalanceRepository.findById(account).orElseGet(() -> UserBalance.empty(account));
    }

    private LoanPosition load(Long positionId) {
        if (positionId == null) {
            throw new LendingException(LendingErrorCode.POSITION_NOT_FOUND, "Position id is required");
        }
        return loanPositionRepository.findById(positionId)
                .orElseThrow(() -> new LendingException(LendingErrorCode.POSITION_NOT_FOUND, "Position " + positionId + " not found"));
    }

    private LoanPosition loadOpen(Long positionId) {
        LoanPosition position = load(positionId);
        if (!position.isOpen()) {
            throw new LendingException(
                    LendingErrorCode.POSITION_NOT_OPEN,
                    "Position " + positionId + " is " + position.getStatus()
            );
        }
        return position;
    }

    private void requireAddress(String address, String name) {
        if (address == null || address.isBlank()) {
            throw new LendingException(LendingErrorCode.INVALID_ADDRESS, name + " is required");
        }
    }

    record Prices(BigInteger collateral, BigInteger debt) {
    }
}
