package com.polymarket.ctf.domain.event;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class PositionMerge implements LedgerEvent {
    String stakeholder;
    String collateralToken;
    BigInteger parentSlotId;
    String conditionId;
    BigInteger amount;
}
