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
@Table(name = "user_balances")
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class UserBalance extends AuditableEntity {

    @Id
    private String account;

    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger collateralBalance;

    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger debtBalance;

    @Version
    private Long version;

    public static UserBalance empty(String account) {
        return UserBalance.builder()
                .account(account)
                .collateralBalance(BigInteger.ZERO)
                .debtBalance(BigInteger.ZERO)
                .build();
    }
}
