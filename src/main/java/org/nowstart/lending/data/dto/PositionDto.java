package org.nowstart.lending.data.dto;

import java.math.BigInteger;
import org.nowstart.lending.data.type.PositionStatus;

public record PositionDto(
        Long id,
        String owner,
        BigInteger collateralAmount,
        BigInteger debtAmount,
        PositionStatus status,
        Integer leverage
) {
}
