package org.nowstart.lending.service.token;

import java.math.BigInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.lending.data.entity.TokenAllowance;
import org.nowstart.lending.data.entity.TokenBalance;
import org.nowstart.lending.data.exception.LendingException;
import org.nowstart.lending.data.type.LendingErrorCode;
import org.nowstart.lending.repository.TokenAllowanceRepository;
import org.nowstart.lending.repository.TokenBalanceRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Token balances kept in the ledger database, so token movements commit or roll back together
 * with the position updates that caused them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LocalTokenLedger implements TokenGateway {

    private final TokenBalanceRepository tokenBalanceRepository;
    private final TokenAllowanceRepository tokenAllowanceRepository;

    @Override
    @Transactional(readOnly = true)
    public BigInteger balanceOf(String token, String holder) {
        return tokenBalanceRepository.findById(new TokenBalance.TokenBalanceKey(token, holder))
                .map(TokenBalance::getAmount)
                .orElse(BigInteger.ZERO);
    }

    @Override
    @Transactional(readOnly = true)
    public BigInteger allowance(String token, String owner, String spender) {
        return tokenAllowanceRepository.findById(new TokenAllowance.TokenAllowanceKey(token, owner, spender))
                .map(TokenAllowance::getAmount)
                .orElse(BigInteger.ZERO);
    }

    @Override
    @Transactional
    public void approve(String token, String owner, String spender, BigInteger amount) {
        requireAccount(owner);
        requireAccount(spender);
        if (amount == null || amount.signum() < 0) {
            throw new LendingException(LendingErrorCode.INVALID_AMOUNT, "Allowance must not be negative");
        }
        TokenAllowance.TokenAllowanceKey key = new TokenAllowance.TokenAllowanceKey(token, owner, spender);
        TokenAllowance allowance = tokenAllowanceRepository.findById(key)
                .orElseGet(() -> TokenAllowance.builder().id(key).amount(BigInteger.ZERO).build());
        allowance.setAmount(amount);
        tokenAllowanceRepository.save(allowance);
    }

    @Override
    @Transactional
    public void transfer(String token, String from, String to, BigInteger amount) {
        requireAccount(to);
        requireAmount(amount);
        debit(token, from, amount);
        credit(token, to, amount);
    }

    @Override
    @Transactional
    public void transferFrom(String token, String spender, String from, String to, BigInteger amount) {
        requireAccount(to);
        requireAmount(amount);
        TokenAllowance.TokenAllowanceKey key = new TokenAllowance.TokenAllowanceKey(token, from, spender);
        TokenAllowance allowance = tokenAllowanceRepository.findById(key)
                .orElseThrow(() -> new LendingException(
                        LendingErrorCode.INSUFFICIENT_ALLOWANCE,
                        spender + " has no " + token + " allowance from " + from
                ));
        if (allowance.getAmount().compareTo(amount) < 0) {
            throw new LendingException(
                    LendingErrorCode.INSUFFICIENT_ALLOWANCE,
                    "Allowance " + allowance.getAmount() + " is below " + amount + " " + token
            );
        }

        debit(token, from, amount);
        credit(token, to, amount);
        allowance.setAmount(allowance.getAmount().subtract(amount));
        tokenAllowanceRepository.save(allowance);
    }

    @Override
    @Transactional
    public void mint(String token, String to, BigInteger amount) {
        requireAccount(to);
        requireAmount(amount);
        credit(token, to, amount);
        log.debug("event=token_mint token={} to={} amount={}", token, to, amount);
    }

    @Override
    @Transactional
    public void burn(String token, String from, BigInteger amount) {
        requireAmount(amount);
        debit(token, from, amount);
        log.debug("event=token_burn token={} from={} amount={}", token, from, amount);
    }

    private void debit(String token, String holder, BigInteger amount) {
        TokenBalance balance = tokenBalanceRepository.findById(new TokenBalance.TokenBalanceKey(token, holder))
                .orElse(null);
        BigInteger available = balance == null ? BigInteger.ZERO : balance.getAmount();
        if (available.compareTo(amount) < 0) {
            throw new LendingException(
                    LendingErrorCode.INSUFFICIENT_BALANCE,
                    holder + " holds " + available + " " + token + ", needs " + amount
            );
        }
        balance.setAmount(available.subtract(amount));
        tokenBalanceRepository.save(balance);
    }

    private void credit(String token, String holder, BigInteger amount) {
        TokenBalance.TokenBalanceKey key = new TokenBalance.TokenBalanceKey(token, holder);
        TokenBalance balance = tokenBalanceRepository.findById(key)
                .orElseGet(() -> TokenBalance.builder().id(key).amount(BigInteger.ZERO).build());
        balance.setAmount(balance.getAmount().add(amount));
        tokenBalanceRepository.save(balance);
    }

    private void requireAmount(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new LendingException(LendingErrorCode.INVALID_AMOUNT, "Token amount must be greater than zero");
        }
    }

    private void requireAccount(String account) {
        if (account == null || account.isBlank()) {
            throw new LendingException(LendingErrorCode.INVALID_ADDRESS, "Account is required");
        }
    }
}
