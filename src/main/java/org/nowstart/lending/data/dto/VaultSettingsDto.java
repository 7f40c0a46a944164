package org.nowstart.lending.data.dto;

public record VaultSettingsDto(
        String vaultAddress,
        String collateralAsset,
        String debtAsset,
        int ltvRatio,
        int liquidationThreshold,
        int liquidatorRewardBips,
        String treasury,
        String collateralFeed,
        String debtFeed
) {
}
