package org.nowstart.lending.service.swap;

import java.math.BigInteger;

public interface SwapRouter {

    /**
     * Sells exactly {@code amountIn} of the route's first token held by {@code trader} and
     * delivers at least {@code minAmountOut} of the last token back to {@code trader}.
     *
     * @return amount of the output token delivered
     */
    BigInteger swapExactInput(String trader, SwapRoute route, BigInteger amountIn, BigInteger minAmountOut);
}
