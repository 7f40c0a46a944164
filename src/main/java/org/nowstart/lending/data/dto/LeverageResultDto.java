package org.nowstart.lending.data.dto;

import java.math.BigInteger;
import java.util.List;

public record LeverageResultDto(
        Long positionId,
        BigInteger totalCollateral,
        BigInteger totalDebt,
        int leverage,
        List<BigInteger> swapOutputs,
        BigInteger returnedDebt
) {
}
