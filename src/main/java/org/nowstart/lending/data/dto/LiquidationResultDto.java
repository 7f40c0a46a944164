package org.nowstart.lending.data.dto;

import java.math.BigInteger;

public record LiquidationResultDto(
        Long positionId,
        String liquidator,
        BigInteger seizedCollateral,
        BigInteger liquidatorReward,
        BigInteger treasuryShare,
        BigInteger writtenOffDebt
) {
}
