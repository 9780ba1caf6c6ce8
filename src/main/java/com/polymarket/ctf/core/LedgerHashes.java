package com.polymarket.ctf.core;

import org.web3j.abi.datatypes.Address;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * keccak256 over tightly packed fields, the way the identifiers are computed on-chain.
 */
public final class LedgerHashes {

    public static final int WORD_SIZE = 32;
    public static final BigInteger WORD_MODULUS = BigInteger.ONE.shiftLeft(256);
    public static final BigInteger MAX_WORD = WORD_MODULUS.subtract(BigInteger.ONE);

    private static final int ADDRESS_SIZE = 20;

    private LedgerHashes() {
    }

    /**
     * keccak256(oracle ‖ questionId ‖ uint256(outcomeSlotCount)).
     */
    public static String conditionId(String oracle, String questionId, int outcomeSlotCount) {
        return Numeric.toHexString(Hash.sha3(concat(
                addressBytes(oracle),
                bytes32(questionId),
                Numeric.toBytesPadded(BigInteger.valueOf(outcomeSlotCount), WORD_SIZE))));
    }

    /**
     * uint(keccak256(conditionId ‖ uint256(index))).
     */
    public static BigInteger outcomeHash(String conditionId, int index) {
        return Numeric.toBigInt(Hash.sha3(concat(
                bytes32(conditionId),
                Numeric.toBytesPadded(BigInteger.valueOf(index), WORD_SIZE))));
    }

    /**
     * uint(keccak256(collateral ‖ slotId)).
     */
    public static BigInteger positionId(String collateralToken, BigInteger slotId) {
        return Numeric.toBigInt(Hash.sha3(concat(
                addressBytes(collateralToken),
                Numeric.toBytesPadded(requireWord(slotId, "slotId"), WORD_SIZE))));
    }

    /**
     * Lower-case 0x form of a 20-byte address.
     */
    public static String normalizeAddress(String address) {
        if (address == null || Numeric.cleanHexPrefix(address).length() != ADDRESS_SIZE * 2) {
            throw new IllegalArgumentException("Expected 20-byte hex address, got " + address);
        }
        return new Address(address).toString();
    }

    /**
     * Lower-case 0x form of a 32-byte identifier.
     */
    public static String normalizeBytes32(String hex) {
        return Numeric.toHexString(bytes32(hex));
    }

    public static BigInteger requireWord(BigInteger value, String name) {
        if (value == null || value.signum() < 0 || value.compareTo(MAX_WORD) > 0) {
            throw new IllegalArgumentException(name + " must be an unsigned 256-bit integer, got " + value);
        }
        return value;
    }

    static byte[] addressBytes(String address) {
        return Numeric.hexStringToByteArray(normalizeAddress(address));
    }

    static byte[] bytes32(String hex) {
        byte[] bytes;
        try {
            bytes = Numeric.hexStringToByteArray(hex);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid bytes32 hex: " + hex, e);
        }
        if (bytes.length != WORD_SIZE) {
            throw new IllegalArgumentException("Expected bytes32 hex (32 bytes), got len=" + bytes.length + " hex=" + hex);
        }
        return bytes;
    }

    private static byte[] concat(byte[]... arrays) {
        int totalLength = Arrays.stream(arrays).mapToInt(a -> a.length).sum();
        ByteBuffer buffer = ByteBuffer.allocate(totalLength);
        for (byte[] array : arrays) {
            buffer.put(array);
        }
        return buffer.array();
    }
}
