package org.nowstart.lending.service.swap;

import java.math.BigInteger;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.lending.data.entity.VaultSettings;
import org.nowstart.lending.data.exception.LendingException;
import org.nowstart.lending.data.property.LendingProperties;
import org.nowstart.lending.data.type.LendingErrorCode;
import org.nowstart.lending.service.math.FixedPointMath;
import org.nowstart.lending.service.oracle.PriceOracleService;
import org.nowstart.lending.service.token.TokenGateway;
import org.nowstart.lending.service.vault.VaultSettingsService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Fills swaps at oracle prices minus a fee, out of the inventory the router account holds in
 * the local token ledger.
 */
@Slf4j
@Service
public class PaperSwapRouter implements SwapRouter {

    private final TokenGateway tokenGateway;
    private final PriceOracleService priceOracleService;
    private final VaultSettingsService vaultSettingsService;
    private final LendingProperties lendingProperties;

    public PaperSwapRouter(
            TokenGateway tokenGateway,
            PriceOracleService priceOracleService,
            VaultSettingsService vaultSettingsService,
            LendingProperties lendingProperties
    ) {
        this.tokenGateway = tokenGateway;
        this.priceOracleService = priceOracleService;
        this.vaultSettingsService = vaultSettingsService;
        this.lendingProperties = lendingProperties;
    }

    @Override
    @Transactional
    public BigInteger swapExactInput(String trader, SwapRoute route, BigInteger amountIn, BigInteger minAmountOut) {
        FixedPointMath.requirePositive(amountIn, LendingErrorCode.INVALID_AMOUNT, "amountIn");
        BigInteger minimum = FixedPointMath.orZero(minAmountOut);
        VaultSettings settings = vaultSettingsService.current();

        BigInteger amount = amountIn;
        for (int hop = 1; hop < route.path().size(); hop++) {
            amount = quoteHop(settings, route.path().get(hop - 1), route.path().get(hop), amount);
        }

        if (amount.signum() == 0) {
            throw new LendingException(LendingErrorCode.SWAP_FAILED, "Swap of " + amountIn + " " + route.tokenIn() + " yields nothing");
        }
        if (amount.compareTo(minimum) < 0) {
            throw new LendingException(
                    LendingErrorCode.INSUFFICIENT_OUTPUT,
                    "Swap output " + amount + " " + route.tokenOut() + " is below minimum " + minimum
            );
        }

        String router = lendingProperties.leverage().routerAddress();
        BigInteger inventory = tokenGateway.balanceOf(route.tokenOut(), router);
        if (inventory.compareTo(amount) < 0) {
            throw new LendingException(
                    LendingErrorCode.SWAP_FAILED,
                    "Router inventory " + inventory + " " + route.tokenOut() + " cannot cover " + amount
            );
        }

        tokenGateway.transferFrom(route.tokenIn(), router, trader, router, amountIn);
        tokenGateway.transfer(route.tokenOut(), router, trader, amount);

        log.info(
                "event=paper_swap trader={} route={} amount_in={} amount_out={} min_amount_out={}",
                trader,
                route.path(),
                amountIn,
                amount,
                minimum
        );
        return amount;
    }

    private BigInteger quoteHop(VaultSettings settings, String tokenIn, String tokenOut, BigInteger amountIn) {
        BigInteger priceIn = priceOracleService.priceOf(vaultSettingsService.feedFor(settings, tokenIn)).price();
        BigInteger priceOut = priceOracleService.priceOf(vaultSettingsService.feedFor(settings, tokenOut)).price();
        int decimalsIn = vaultSettingsService.decimalsFor(settings, tokenIn);
        int decimalsOut = vaultSettingsService.decimalsFor(settings, tokenOut);

        BigInteger gross = FixedPointMath.mulDiv(
                amountIn.multiply(priceIn),
                FixedPointMath.pow10(decimalsOut),
                priceOut.multiply(FixedPointMath.pow10(decimalsIn))
        );
        BigInteger feeFactor = FixedPointMath.BIPS.subtract(BigInteger.valueOf(lendingProperties.leverage().swapFeeBips()));
        return FixedPointMath.mulDiv(gross, feeFactor, FixedPointMath.BIPS);
    }
}
