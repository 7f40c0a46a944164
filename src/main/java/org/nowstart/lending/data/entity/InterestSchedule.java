package org.nowstart.lending.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;

@Entity
@Table(name = "interest_schedules")
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class InterestSchedule extends AuditableEntity {

    public static final String DEFAULT_ID = "default";

    @Id
    private String id;

    private long periodBlocks;

    private long blocksPerYear;

    // periodBlocks / blocksPerYear, scaled by PRECISION
    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger periodShare;
}
