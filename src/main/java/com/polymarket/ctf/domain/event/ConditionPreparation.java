package com.polymarket.ctf.domain.event;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConditionPreparation implements LedgerEvent {
    String conditionId;
    String oracle;
    String questionId;
    int outcomeSlotCount;
}
