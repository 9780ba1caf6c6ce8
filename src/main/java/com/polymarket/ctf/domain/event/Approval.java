package com.polymarket.ctf.domain.event;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class Approval implements LedgerEvent {
    String owner;
    String spender;
    BigInteger id;
    BigInteger oldValue;
    BigInteger value;
}
