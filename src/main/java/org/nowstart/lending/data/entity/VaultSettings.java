package org.nowstart.lending.data.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "vault_settings")
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class VaultSettings extends AuditableEntity {

    @Id
    private String vaultAddress;

    private String collateralAsset;

    private int collateralDecimals;

    private String debtAsset;

    private int debtDecimals;

    private int ltvRatio;

    private int liquidationThreshold;

    private int liquidatorRewardBips;

    private String treasury;

    private String collateralFeed;

    private String debtFeed;

    @Version
    private Long version;
}
