package org.nowstart.lending.data.dto;

import java.math.BigInteger;

public record InterestDueDto(
        String vault,
        Long positionId,
        BigInteger debtAmount,
        BigInteger interestDue,
        long lastCollectionBlock,
        long currentBlock
) {
}
