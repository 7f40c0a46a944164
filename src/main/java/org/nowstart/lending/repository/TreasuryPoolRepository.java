package org.nowstart.lending.repository;

import org.nowstart.lending.data.entity.TreasuryPool;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TreasuryPoolRepository extends JpaRepository<TreasuryPool, String> {
}
