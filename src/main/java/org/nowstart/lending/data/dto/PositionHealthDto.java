package org.nowstart.lending.data.dto;

import java.math.BigInteger;

public record PositionHealthDto(
        Long positionId,
        BigInteger health,
        BigInteger maxDebt,
        BigInteger maxBorrowable,
        boolean liquidatable
) {
}
