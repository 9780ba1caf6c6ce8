package com.polymarket.ctf.infra;

import com.polymarket.ctf.core.LedgerHashes;
import com.polymarket.ctf.domain.LedgerError;
import com.polymarket.ctf.domain.LedgerException;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Packs payout vectors as consecutive uint256 words, the format oracles report results in.
 */
public final class PayoutResultCodec {

    public static final int UNIT_WIDTH = LedgerHashes.WORD_SIZE;

    private PayoutResultCodec() {
    }

    public static byte[] encode(List<BigInteger> payoutNumerators) {
        StringBuilder hex = new StringBuilder();
        for (BigInteger numerator : payoutNumerators) {
            hex.append(TypeEncoder.encode(new Uint256(LedgerHashes.requireWord(numerator, "payout numerator"))));
        }
        return Numeric.hexStringToByteArray(hex.toString());
    }

    public static byte[] encode(long... payoutNumerators) {
        List<BigInteger> values = new ArrayList<>(payoutNumerators.length);
        for (long numerator : payoutNumerators) {
            values.add(BigInteger.valueOf(numerator));
        }
        return encode(values);
    }

    public static List<BigInteger> decode(byte[] result) {
        if (result == null || result.length == 0 || result.length % UNIT_WIDTH != 0) {
            throw new LedgerException(LedgerError.MALFORMED_RESULT,
                    "length=" + (result == null ? "null" : result.length));
        }
        List<BigInteger> numerators = new ArrayList<>(result.length / UNIT_WIDTH);
        for (int offset = 0; offset < result.length; offset += UNIT_WIDTH) {
            numerators.add(Numeric.toBigInt(result, offset, UNIT_WIDTH));
        }
        return numerators;
    }
}
