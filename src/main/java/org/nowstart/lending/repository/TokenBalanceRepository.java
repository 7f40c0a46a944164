package org.nowstart.lending.repository;

import org.nowstart.lending.data.entity.TokenBalance;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TokenBalanceRepository extends JpaRepository<TokenBalance, TokenBalance.TokenBalanceKey> {
}
