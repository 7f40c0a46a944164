package org.nowstart.lending.data.entity;

import jakarta.persistence.Column;
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

import java.math.BigInteger;

@Entity
@Table(name = "treasury_pools")
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TreasuryPool extends AuditableEntity {

    @Id
    private String token;

    // collected interest not yet paid out to the treasury
    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger pendingInterest;

    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger withdrawnInterest;

    // debt written off by liquidations; the debt asset already minted stays in circulation
    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger absorbedLoss;

    @Version
    private Long version;

    public static TreasuryPool empty(String token) {
        return TreasuryPool.builder()
                .token(token)
                .pendingInterest(BigInteger.ZERO)
                .withdrawnInterest(BigInteger.ZERO)
                .absorbedLoss(BigInteger.ZERO)
                .build();
    }
}
