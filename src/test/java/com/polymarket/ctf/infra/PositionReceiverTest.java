package com.polymarket.ctf.infra;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.web3j.utils.Numeric;

class PositionReceiverTest {

    @Test
    void acknowledgmentIsTheCallbackSelector() {
        Assertions.assertEquals("0xf23a6e61", Numeric.toHexString(PositionReceiver.ACCEPTED));
    }

    @Test
    void acceptedReturnsACopy() {
        byte[] copy = PositionReceiver.accepted();
        copy[0] = 0;

        Assertions.assertEquals("0xf23a6e61", Numeric.toHexString(PositionReceiver.accepted()));
    }
}
