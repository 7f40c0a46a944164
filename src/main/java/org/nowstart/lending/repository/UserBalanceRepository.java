package org.nowstart.lending.repository;

import org.nowstart.lending.data.entity.UserBalance;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserBalanceRepository extends JpaRepository<UserBalance, String> {
}
