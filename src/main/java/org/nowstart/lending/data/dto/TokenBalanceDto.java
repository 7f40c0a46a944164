package org.nowstart.lending.data.dto;

import java.math.BigInteger;

public record TokenBalanceDto(
        String token,
        String holder,
        BigInteger balance
) {
}
