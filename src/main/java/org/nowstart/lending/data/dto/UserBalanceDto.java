package org.nowstart.lending.data.dto;

import java.math.BigInteger;

public record UserBalanceDto(
        String account,
        BigInteger collateralBalance,
        BigInteger debtBalance
) {
}
