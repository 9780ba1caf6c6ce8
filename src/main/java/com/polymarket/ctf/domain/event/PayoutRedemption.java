package com.polymarket.ctf.domain.event;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class PayoutRedemption implements LedgerEvent {
    String redeemer;
    String collateralToken;
    BigInteger parentSlotId;
    String conditionId;
    BigInteger payout;
}
