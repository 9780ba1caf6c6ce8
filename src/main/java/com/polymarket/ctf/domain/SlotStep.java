package com.polymarket.ctf.domain;

import lombok.Value;

/**
 * One level of nesting in a position: outcome {@code index} of condition {@code conditionId}.
 */
@Value(staticConstructor = "of")
public class SlotStep {
    String conditionId;
    int index;
}
