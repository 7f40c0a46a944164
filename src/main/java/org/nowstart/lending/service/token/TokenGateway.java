package org.nowstart.lending.service.token;

import java.math.BigInteger;

/**
 * Fungible token primitives. Every failure is raised as an exception that aborts the enclosing
 * ledger call.
 */
public interface TokenGateway {

    BigInteger balanceOf(String token, String holder);

    BigInteger allowance(String token, String owner, String spender);

    void approve(String token, String owner, String spender, BigInteger amount);

    void transfer(String token, String from, String to, BigInteger amount);

    /**
     * Moves {@code amount} from {@code from} to {@code to} on behalf of {@code spender},
     * consuming the allowance {@code from} granted to {@code spender}.
     */
    void transferFrom(String token, String spender, String from, String to, BigInteger amount);

    void mint(String token, String to, BigInteger amount);

    void burn(String token, String from, BigInteger amount);
}
