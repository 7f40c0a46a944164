package org.nowstart.lending.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.lending.data.type.PositionStatus;

import java.math.BigInteger;

/**
 * A collateralized loan. Rows are never deleted: a liquidated or closed position keeps its id
 * with zero collateral and zero debt.
 */
@Entity
@Table(name = "loan_positions", indexes = @Index(name = "idx_loan_positions_owner", columnList = "owner"))
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LoanPosition extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String owner;

    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger collateralAmount;

    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger debtAmount;

    @Enumerated(EnumType.STRING)
    private PositionStatus status;

    private Integer leverage;

    @Version
    private Long version;

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    public boolean hasDebt() {
        return debtAmount != null && debtAmount.signum() > 0;
    }
}
