package org.nowstart.lending.service.admin;

import java.math.BigInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.lending.data.dto.VaultSettingsDto;
import org.nowstart.lending.data.entity.VaultSettings;
import org.nowstart.lending.data.exception.LendingException;
import org.nowstart.lending.data.type.LendingErrorCode;
import org.nowstart.lending.data.type.Permission;
import org.nowstart.lending.data.type.PositionStatus;
import org.nowstart.lending.repository.LoanPositionRepository;
import org.nowstart.lending.repository.VaultSettingsRepository;
import org.nowstart.lending.service.audit.AuditEventService;
import org.nowstart.lending.service.auth.AccessControlService;
import org.nowstart.lending.service.interest.InterestAccrualService;
import org.nowstart.lending.service.ledger.LedgerGuard;
import org.nowstart.lending.service.math.FixedPointMath;
import org.nowstart.lending.service.token.TokenGateway;
import org.nowstart.lending.service.vault.VaultSettingsService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owner-only changes to the vault configuration. Every change is audited with its old and new
 * value.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VaultAdminService {

    private final VaultSettingsService vaultSettingsService;
    private final VaultSettingsRepository vaultSettingsRepository;
    private final LoanPositionRepository loanPositionRepository;
    private final InterestAccrualService interestAccrualService;
    private final AccessControlService accessControlService;
    private final TokenGateway tokenGateway;
    private final AuditEventService auditEventService;
    private final LedgerGuard ledgerGuard;

    @Transactional(readOnly = true)
    public VaultSettingsDto getSettings() {
        return vaultSettingsService.toDto(vaultSettingsService.current());
    }

    @Transactional
    public VaultSettingsDto updatePriceFeed(String caller, String asset, String feedId) {
        try (LedgerGuard.Permit ignored = ledgerGuard.enter("updatePriceFeed")) {
            accessControlService.require(caller, Permission.ADMIN);
            if (feedId == null || feedId.isBlank()) {
                throw new LendingException(LendingErrorCode.PRICE_FEED_NOT_CONFIGURED, "feedId is required");
            }
            VaultSettings settings = vaultSettingsService.current();
            String previous = vaultSettingsService.feedFor(settings, asset);
            if (settings.getCollateralAsset().equals(asset)) {
                settings.setCollateralFeed(feedId);
            } else {
                settings.setDebtFeed(feedId);
            }
            return save(caller, settings, "price_feed." + asset, previous, feedId);
        }
    }

    @Transactional
    public VaultSettingsDto updateLtv(String caller, int ltvRatio, int liquidationThreshold) {
        try (LedgerGuard.Permit ignored = ledgerGuard.enter("updateLtv")) {
            accessControlService.require(caller, Permission.ADMIN);
            VaultSettingsService.validateRatios(ltvRatio, liquidationThreshold);
            VaultSettings settings = vaultSettingsService.current();
            String previous = settings.getLtvRatio() + "/" + settings.getLiquidationThreshold();
            settings.setLtvRatio(ltvRatio);
            settings.setLiquidationThreshold(liquidationThreshold);
            return save(caller, settings, "ltv", previous, ltvRatio + "/" + liquidationThreshold);
        }
    }

    @Transactional
    public VaultSettingsDto updateLiquidatorReward(String caller, int liquidatorRewardBips) {
        try (LedgerGuard.Permit ignored = ledgerGuard.enter("updateLiquidatorReward")) {
            accessControlService.require(caller, Permission.ADMIN);
            if (liquidatorRewardBips < 0 || liquidatorRewardBips > FixedPointMath.BIPS.intValue()) {
                throw new LendingException(LendingErrorCode.INVALID_CONFIGURATION, "liquidatorRewardBips must be within [0, 10000]");
            }
            VaultSettings settings = vaultSettingsService.current();
            int previous = settings.getLiquidatorRewardBips();
            settings.setLiquidatorRewardBips(liquidatorRewardBips);
            return save(caller, settings, "liquidator_reward_bips", String.valueOf(previous), String.valueOf(liquidatorRewardBips));
        }
    }

    @Transactional
    public VaultSettingsDto updateTreasury(String caller, String treasury) {
        try (LedgerGuard.Permit ignored = ledgerGuard.enter("updateTreasury")) {
            accessControlService.require(caller, Permission.ADMIN);
            if (treasury == null || treasury.isBlank()) {
                throw new LendingException(LendingErrorCode.INVALID_ADDRESS, "treasury is required");
            }
            VaultSettings settings = vaultSettingsService.current();
            String previous = settings.getTreasury();
            settings.setTreasury(treasury);
            return save(caller, settings, "treasury", previous, treasury);
        }
    }

    /**
     * Sends tokens held by the vault account that no open position accounts for. Collateral
     * locked in open positions can never leave through this path.
     */
    @Transactional
    public BigInteger emergencyWithdraw(String caller, String token, String to, BigInteger amount) {
        try (LedgerGuard.Permit ignored = ledgerGuard.enter("emergencyWithdraw")) {
            accessControlService.require(caller, Permission.ADMIN);
            if (to == null || to.isBlank()) {
                throw new LendingException(LendingErrorCode.INVALID_ADDRESS, "Recipient is required");
            }
            FixedPointMath.requirePositive(amount, LendingErrorCode.INVALID_AMOUNT, "amount");

            VaultSettings settings = vaultSettingsService.current();
            BigInteger available = tokenGateway.balanceOf(token, settings.getVaultAddress());
            if (settings.getCollateralAsset().equals(token)) {
                BigInteger locked = FixedPointMath.orZero(loanPositionRepository.sumCollateralByStatus(PositionStatus.OPEN));
                available = available.subtract(locked);
            }
            if (amount.compareTo(available) > 0) {
                throw new LendingException(
                        LendingErrorCode.INSUFFICIENT_BALANCE,
                        "Only " + FixedPointMath.max(available, BigInteger.ZERO) + " " + token + " can be withdrawn"
                );
            }

            tokenGateway.transfer(token, settings.getVaultAddress(), to, amount);
            auditEventService.record("ADMIN_EMERGENCY_WITHDRAW", caller, "token=" + token + " to=" + to + " amount=" + amount);
            log.info("event=admin_update field=emergency_withdraw token={} to={} amount={}", token, to, amount);
            return amount;
        }
    }

    /**
     * Credits tokens to an account of the local token ledger, used to fund paper accounts such as
     * the swap router inventory.
     */
    @Transactional
    public void mintTokens(String caller, String token, String to, BigInteger amount) {
        accessControlService.require(caller, Permission.ADMIN);
        tokenGateway.mint(token, to, amount);
        auditEventService.record("ADMIN_TOKENS_MINTED", caller, "token=" + token + " to=" + to + " amount=" + amount);
        log.info("event=admin_update field=mint token={} to={} amount={}", token, to, amount);
    }

    @Transactional
    public void grantRole(String caller, String account, Permission role) {
        accessControlService.require(caller, Permission.ADMIN);
        accessControlService.grant(account, role, caller);
        auditEventService.record("ADMIN_ROLE_GRANTED", caller, "account=" + account + " role=" + role);
        log.info("event=admin_update field=role_grant account={} role={}", account, role);
    }

    @Transactional
    public boolean revokeRole(String caller, String account, Permission role) {
        accessControlService.require(caller, Permission.ADMIN);
        boolean revoked = accessControlService.revoke(account, role);
        if (revoked) {
            auditEventService.record("ADMIN_ROLE_REVOKED", caller, "account=" + account + " role=" + role);
            log.info("event=admin_update field=role_revoke account={} role={}", account, role);
        }
        return revoked;
    }

    public void updatePeriodBlocks(String caller, long periodBlocks) {
        interestAccrualService.updatePeriodBlocks(caller, periodBlocks);
    }

    public void updateVaultRate(String caller, String vault, int annualRateBips) {
        interestAccrualService.updateVaultRate(caller, vault, annualRateBips);
    }

    public BigInteger withdrawTreasury(String caller, String token) {
        return interestAccrualService.withdrawTreasury(caller, token);
    }

    private VaultSettingsDto save(String caller, VaultSettings settings, String field, String previous, String updated) {
        vaultSettingsRepository.save(settings);
        auditEventService.record("ADMIN_SETTINGS_UPDATED", caller, "field=" + field + " old=" + previous + " new=" + updated);
        log.info("event=admin_update field={} old={} new={}", field, previous, updated);
        return vaultSettingsService.toDto(settings);
    }
}
