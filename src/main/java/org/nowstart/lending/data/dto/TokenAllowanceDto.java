package org.nowstart.lending.data.dto;

import java.math.BigInteger;

public record TokenAllowanceDto(
        String token,
        String owner,
        String spender,
        BigInteger amount
) {
}
