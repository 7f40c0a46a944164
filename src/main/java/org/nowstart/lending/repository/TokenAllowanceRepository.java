package org.nowstart.lending.repository;

import org.nowstart.lending.data.entity.TokenAllowance;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TokenAllowanceRepository extends JpaRepository<TokenAllowance, TokenAllowance.TokenAllowanceKey> {
}
