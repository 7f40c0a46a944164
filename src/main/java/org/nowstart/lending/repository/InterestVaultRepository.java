package org.nowstart.lending.repository;

import org.nowstart.lending.data.entity.InterestVault;
import org.springframework.data.jpa.repository.JpaRepository;

public interface InterestVaultRepository extends JpaRepository<InterestVault, String> {
}
