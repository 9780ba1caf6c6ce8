package com.polymarket.ctf.domain.event;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConditionResolution implements LedgerEvent {
    String conditionId;
    String oracle;
    String questionId;
    int outcomeSlotCount;
    String result; // raw result bytes as 0x hex
}
