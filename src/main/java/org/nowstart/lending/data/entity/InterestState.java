package org.nowstart.lending.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.io.Serializable;
import java.math.BigInteger;

@Entity
@Table(name = "interest_states")
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class InterestState extends AuditableEntity {

    public static final long INACTIVE = 0L;

    @EmbeddedId
    private InterestStateKey id;

    private long lastCollectionBlock;

    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger totalCollected;

    public boolean isActive() {
        return lastCollectionBlock != INACTIVE;
    }

    @Embeddable
    @Getter
    @Setter
    @NoArgsConstructor(access = AccessLevel.PROTECTED)
    @AllArgsConstructor
    @EqualsAndHashCode
    public static class InterestStateKey implements Serializable {

        private String vaultAddress;

        private Long positionId;
    }
}
