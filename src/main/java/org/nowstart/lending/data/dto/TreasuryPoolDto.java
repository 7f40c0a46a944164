package org.nowstart.lending.data.dto;

import java.math.BigInteger;

public record TreasuryPoolDto(
        String token,
        BigInteger pendingInterest,
        BigInteger withdrawnInterest,
        BigInteger absorbedLoss
) {
}
