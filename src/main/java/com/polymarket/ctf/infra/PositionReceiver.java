package com.polymarket.ctf.infra;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Contract-like account that must acknowledge incoming safe transfers.
 */
public interface PositionReceiver {

    String SIGNATURE = "onERC1155Received(address,address,uint256,uint256,bytes)";

    /** First four bytes of keccak256(SIGNATURE), i.e. 0xf23a6e61. */
    byte[] ACCEPTED = Arrays.copyOf(Numeric.hexStringToByteArray(Hash.sha3String(SIGNATURE)), 4);

    /**
     * @return {@link #ACCEPTED} to take the transfer; anything else rejects it
     */
    byte[] onERC1155Received(String operator, String from, BigInteger id, BigInteger value, byte[] data);

    static byte[] accepted() {
        return ACCEPTED.clone();
    }
}
