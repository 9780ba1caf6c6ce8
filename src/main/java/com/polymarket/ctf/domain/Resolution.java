package com.polymarket.ctf.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

/**
 * Payout vector reported for a condition.
 */
@Value
@Builder
public class Resolution {
    String conditionId;
    List<BigInteger> payoutNumerators;
    BigInteger payoutDenominator;

    /**
     * Share of {@code balance} paid for outcome {@code index}, truncated toward zero.
     */
    public BigInteger payoutFor(int index, BigInteger balance) {
        return balance.multiply(payoutNumerators.get(index)).divide(payoutDenominator);
    }
}
