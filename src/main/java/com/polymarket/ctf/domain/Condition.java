package com.polymarket.ctf.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Condition {
    String conditionId;
    String oracle; // only this address can report the result
    String questionId;
    int outcomeSlotCount;
}
