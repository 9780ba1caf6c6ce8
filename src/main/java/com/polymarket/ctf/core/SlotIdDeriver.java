package com.polymarket.ctf.core;

import com.polymarket.ctf.domain.SlotStep;

import java.math.BigInteger;
import java.util.List;

/**
 * Derives the slot ids that name nested outcome baskets.
 * <p>
 * A child slot is its parent plus the outcome hash, modulo 2^256. Because the combination is
 * additive, the same set of (condition, index) steps reaches the same slot in any order.
 */
public final class SlotIdDeriver {

    /** Slot of raw, unconditioned collateral. */
    public static final BigInteger ROOT = BigInteger.ZERO;

    private SlotIdDeriver() {
    }

    public static BigInteger getPayoutSlotId(BigInteger parentSlotId, String conditionId, int index) {
        LedgerHashes.requireWord(parentSlotId, "parentSlotId");
        return parentSlotId.add(LedgerHashes.outcomeHash(conditionId, index)).mod(LedgerHashes.WORD_MODULUS);
    }

    public static BigInteger deriveSlotId(BigInteger parentSlotId, List<SlotStep> steps) {
        BigInteger slotId = parentSlotId;
        for (SlotStep step : steps) {
            slotId = getPayoutSlotId(slotId, step.getConditionId(), step.getIndex());
        }
        return slotId;
    }

    public static BigInteger getPositionId(String collateralToken, BigInteger slotId) {
        return LedgerHashes.positionId(collateralToken, slotId);
    }

    public static boolean isRoot(BigInteger slotId) {
        return ROOT.equals(slotId);
    }
}
