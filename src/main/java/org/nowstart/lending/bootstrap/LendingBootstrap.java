package org.nowstart.lending.bootstrap;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.lending.data.entity.InterestSchedule;
import org.nowstart.lending.data.entity.VaultSettings;
import org.nowstart.lending.data.property.LendingProperties;
import org.nowstart.lending.service.interest.InterestAccrualService;
import org.nowstart.lending.service.vault.VaultSettingsService;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class LendingBootstrap {

    private final VaultSettingsService vaultSettingsService;
    private final InterestAccrualService interestAccrualService;
    private final LendingProperties lendingProperties;

    @PostConstruct
    void initialize() {
        VaultSettings settings = vaultSettingsService.current();
        InterestSchedule schedule = interestAccrualService.schedule();
        boolean registered = lendingProperties.interest().enabled()
                && interestAccrualService.registerConfiguredVault(
                        settings.getVaultAddress(),
                        lendingProperties.interest().annualRateBips()
                );
        log.info(
                "event=lending_bootstrap vault={} collateral={} debt={} ltv={} threshold={} period_blocks={} vault_registered={}",
                settings.getVaultAddress(),
                settings.getCollateralAsset(),
                settings.getDebtAsset(),
                settings.getLtvRatio(),
                settings.getLiquidationThreshold(),
                schedule.getPeriodBlocks(),
                registered
        );
    }
}
