package org.nowstart.lending.service.vault;

import lombok.RequiredArgsConstructor;
import org.nowstart.lending.data.dto.VaultSettingsDto;
import org.nowstart.lending.data.entity.VaultSettings;
import org.nowstart.lending.data.exception.LendingException;
import org.nowstart.lending.data.property.LendingProperties;
import org.nowstart.lending.data.type.LendingErrorCode;
import org.nowstart.lending.repository.VaultSettingsRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owner of the vault configuration row. Seeded from {@link LendingProperties} on first use and
 * changed afterwards only through the admin surface.
 */
@Service
@RequiredArgsConstructor
public class VaultSettingsService {

    private final VaultSettingsRepository vaultSettingsRepository;
    private final LendingProperties lendingProperties;

    @Transactional
    public VaultSettings current() {
        String vaultAddress = lendingProperties.vault().address();
        return vaultSettingsRepository.findById(vaultAddress)
                .orElseGet(() -> vaultSettingsRepository.save(seed(vaultAddress)));
    }

    public String feedFor(VaultSettings settings, String asset) {
        if (settings.getCollateralAsset().equals(asset)) {
            return settings.getCollateralFeed();
        }
        if (settings.getDebtAsset().equals(asset)) {
            return settings.getDebtFeed();
        }
        throw new LendingException(LendingErrorCode.INVALID_ASSET, "Asset " + asset + " is not handled by this vault");
    }

    public int decimalsFor(VaultSettings settings, String asset) {
        if (settings.getCollateralAsset().equals(asset)) {
            return settings.getCollateralDecimals();
        }
        if (settings.getDebtAsset().equals(asset)) {
            return settings.getDebtDecimals();
        }
        throw new LendingException(LendingErrorCode.INVALID_ASSET, "Asset " + asset + " is not handled by this vault");
    }

    public VaultSettingsDto toDto(VaultSettings settings) {
        return new VaultSettingsDto(
                settings.getVaultAddress(),
                settings.getCollateralAsset(),
                settings.getDebtAsset(),
                settings.getLtvRatio(),
                settings.getLiquidationThreshold(),
                settings.getLiquidatorRewardBips(),
                settings.getTreasury(),
                settings.getCollateralFeed(),
                settings.getDebtFeed()
        );
    }

    public static void validateRatios(int ltvRatio, int liquidationThreshold) {
        if (ltvRatio <= 0 || ltvRatio > 100) {
            throw new LendingException(LendingErrorCode.INVALID_CONFIGURATION, "ltvRatio must be within (0, 100]");
        }
        if (liquidationThreshold < ltvRatio) {
            throw new LendingException(
                    LendingErrorCode.INVALID_CONFIGURATION,
                    "liquidationThreshold must not be below ltvRatio"
            );
        }
    }

    private VaultSettings seed(String vaultAddress) {
        LendingProperties.Vault vault = lendingProperties.vault();
        validateRatios(vault.ltvRatio(), vault.liquidationThreshold());
        if (vault.collateralAsset().equals(vault.debtAsset())) {
            throw new LendingException(LendingErrorCode.INVALID_CONFIGURATION, "Collateral and debt asset must differ");
        }
        return VaultSettings.builder()
                .vaultAddress(vaultAddress)
                .collateralAsset(vault.collateralAsset())
                .collateralDecimals(vault.collateralDecimals())
                .debtAsset(vault.debtAsset())
                .debtDecimals(vault.debtDecimals())
                .ltvRatio(vault.ltvRatio())
                .liquidationThreshold(vault.liquidationThreshold())
                .liquidatorRewardBips(vault.liquidatorRewardBips())
                .treasury(vault.treasury())
                .collateralFeed(lendingProperties.oracle().collateralFeed())
                .debtFeed(lendingProperties.oracle().debtFeed())
                .build();
    }
}
