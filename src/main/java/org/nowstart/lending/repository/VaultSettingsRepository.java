package org.nowstart.lending.repository;

import org.nowstart.lending.data.entity.VaultSettings;
import org.springframework.data.jpa.repository.JpaRepository;

public interface VaultSettingsRepository extends JpaRepository<VaultSettings, String> {
}
