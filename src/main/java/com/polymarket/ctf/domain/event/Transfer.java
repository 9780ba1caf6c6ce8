package com.polymarket.ctf.domain.event;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class Transfer implements LedgerEvent {
    String operator;
    String from;
    String to;
    BigInteger id;
    BigInteger value;
}
