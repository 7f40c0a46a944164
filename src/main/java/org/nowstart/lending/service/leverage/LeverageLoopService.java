package org.nowstart.lending.service.leverage;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.lending.data.dto.LeverageResultDto;
import org.nowstart.lending.data.entity.LoanPosition;
import org.nowstart.lending.data.entity.VaultSettings;
import org.nowstart.lending.data.exception.LendingException;
import org.nowstart.lending.data.property.LendingProperties;
import org.nowstart.lending.data.type.LendingErrorCode;
import org.nowstart.lending.service.audit.AuditEventService;
import org.nowstart.lending.service.ledger.PositionLedgerService;
import org.nowstart.lending.service.math.FixedPointMath;
import org.nowstart.lending.service.swap.SwapRoute;
import org.nowstart.lending.service.swap.SwapRouter;
import org.nowstart.lending.service.token.TokenGateway;
import org.nowstart.lending.service.vault.VaultSettingsService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;

/**
 * Builds a leveraged position in one transaction: borrow the full headroom, swap it into
 * collateral, deposit, repeat. The last tranche is not swapped and goes back to the caller.
 * Holds no state between calls.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeverageLoopService {

    private final PositionLedgerService positionLedgerService;
    private final SwapRouter swapRouter;
    private final TokenGateway tokenGateway;
    private final VaultSettingsService vaultSettingsService;
    private final AuditEventService auditEventService;
    private final LendingProperties lendingProperties;

    @Transactional
    public LeverageResultDto leveragePosition(
            String caller,
            BigInteger collateralAmount,
            int leverage,
            BigInteger minAmountOut,
            List<String> swapRoute
    ) {
        int maxLeverage = lendingProperties.leverage().maxLeverage();
        if (leverage < 1 || leverage > maxLeverage) {
            throw new LendingException(
                    LendingErrorCode.INVALID_LEVERAGE,
                    "Leverage " + leverage + " must be within [1, " + maxLeverage + "]"
            );
        }
        if (caller == null || caller.isBlank()) {
            throw new LendingException(LendingErrorCode.INVALID_ADDRESS, "Caller is required");
        }
        FixedPointMath.requirePositive(collateralAmount, LendingErrorCode.INVALID_COLLATERAL_AMOUNT, "collateralAmount");

        VaultSettings settings = vaultSettingsService.current();
        SwapRoute route = resolveRoute(settings, swapRoute);
        String builder = lendingProperties.leverage().address();
        String router = lendingProperties.leverage().routerAddress();
        String vault = settings.getVaultAddress();

        tokenGateway.transferFrom(settings.getCollateralAsset(), builder, caller, builder, collateralAmount);
        tokenGateway.approve(settings.getCollateralAsset(), builder, vault, collateralAmount);
        LoanPosition position = positionLedgerService.openPositionFor(builder, caller, collateralAmount, BigInteger.ZERO, leverage);
        Long positionId = position.getId();

        List<BigInteger> swapOutputs = new ArrayList<>();
        for (int iteration = 1; iteration <= leverage; iteration++) {
            BigInteger headroom = positionLedgerService.getMaxBorrowable(positionId);
            if (headroom.signum() == 0) {
                throw new LendingException(
                        LendingErrorCode.NO_BORROW_CAPACITY,
                        "Position " + positionId + " has no borrow capacity at iteration " + iteration
                );
            }
            positionLedgerService.borrowFor(builder, positionId, builder, headroom);
            if (iteration == leverage) {
                break;
            }

            tokenGateway.approve(settings.getDebtAsset(), builder, router, headroom);
            BigInteger bought = swapRouter.swapExactInput(builder, route, headroom, minAmountOut);
            tokenGateway.approve(settings.getCollateralAsset(), builder, vault, bought);
            positionLedgerService.addCollateral(builder, positionId, bought);
            swapOutputs.add(bought);
        }

        BigInteger returnedDebt = tokenGateway.balanceOf(settings.getDebtAsset(), builder);
        if (returnedDebt.signum() > 0) {
            tokenGateway.transfer(settings.getDebtAsset(), builder, caller, returnedDebt);
        }

        LoanPosition built = positionLedgerService.getPosition(positionId);
        auditEventService.record(
                "LEVERAGE_BUILT",
                caller,
                positionId,
                "leverage=" + leverage + " collateral=" + built.getCollateralAmount() + " debt=" + built.getDebtAmount()
        );
        log.info(
                "event=leverage_built position_id={} owner={} leverage={} initial_collateral={} total_collateral={} total_debt={} swaps={} returned_debt={}",
                positionId,
                caller,
                leverage,
                collateralAmount,
                built.getCollateralAmount(),
                built.getDebtAmount(),
                swapOutputs.size(),
                returnedDebt
        );
        return new LeverageResultDto(
                positionId,
                built.getCollateralAmount(),
                built.getDebtAmount(),
                leverage,
                List.copyOf(swapOutputs),
                returnedDebt
        );
    }

    private SwapRoute resolveRoute(VaultSettings settings, List<String> requested) {
        List<String> path = CollectionUtils.isEmpty(requested) ? lendingProperties.leverage().swapRoute() : requested;
        SwapRoute route;
        try {
            route = new SwapRoute(path);
        } catch (IllegalArgumentException e) {
            throw new LendingException(LendingErrorCode.INVALID_ASSET, e.getMessage(), e);
        }
        if (!route.tokenIn().equals(settings.getDebtAsset()) || !route.tokenOut().equals(settings.getCollateralAsset())) {
            throw new LendingException(
                    LendingErrorCode.INVALID_ASSET,
                    "Swap route must sell " + settings.getDebtAsset() + " for " + settings.getCollateralAsset()
            );
        }
        return route;
    }
}
