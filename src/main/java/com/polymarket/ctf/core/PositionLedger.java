package com.polymarket.ctf.core;

import com.polymarket.ctf.domain.LedgerError;
import com.polymarket.ctf.domain.LedgerException;
import com.polymarket.ctf.domain.Resolution;
import com.polymarket.ctf.domain.event.PayoutRedemption;
import com.polymarket.ctf.domain.event.PositionMerge;
import com.polymarket.ctf.domain.event.PositionSplit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Splits, merges and redeems positions.
 * <p>
 * Splitting turns one unit of a basket into one unit of every outcome branch under a condition;
 * merging does the reverse. Either way the collateral backing the positions stays the same.
 * Redemption pays each branch its share of the reported payout vector.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionLedger {

    private final LedgerExecutor executor;
    private final ConditionRegistry registry;
    private final PositionBalances balances;
    private final CollateralCustody custody;

    public void splitPosition(String caller, String collateralToken, BigInteger parentSlotId,
            String conditionId, BigInteger amount) {
        String stakeholder = LedgerHashes.normalizeAddress(caller);
        String collateral = LedgerHashes.normalizeAddress(collateralToken);
        String condition = LedgerHashes.normalizeBytes32(conditionId);
        LedgerHashes.requireWord(parentSlotId, "parentSlotId");
        LedgerHashes.requireWord(amount, "amount");

        executor.run("splitPosition", tx -> {
            int outcomeSlotCount = requirePrepared(condition);
            boolean root = SlotIdDeriver.isRoot(parentSlotId);

            if (!root) {
                balances.debit(tx, stakeholder, SlotIdDeriver.getPositionId(collateral, parentSlotId), amount);
            }
            for (int i = 0; i < outcomeSlotCount; i++) {
                BigInteger slotId = SlotIdDeriver.getPayoutSlotId(parentSlotId, condition, i);
                balances.credit(tx, stakeholder, SlotIdDeriver.getPositionId(collateral, slotId), amount);
            }
            if (root) {
                custody.pull(tx, collateral, stakeholder, amount);
            }

            tx.emit(PositionSplit.builder()
                    .stakeholder(stakeholder)
                    .collateralToken(collateral)
                    .parentSlotId(parentSlotId)
                    .conditionId(condition)
                    .amount(amount)
                    .build());
            log.debug("Split {} of {} under slot {} across {} outcomes of {}",
                    amount, collateral, parentSlotId, outcomeSlotCount, condition);
        });
    }

    public void mergePosition(String caller, String collateralToken, BigInteger parentSlotId,
            String conditionId, BigInteger amount) {
        String stakeholder = LedgerHashes.normalizeAddress(caller);
        String collateral = LedgerHashes.normalizeAddress(collateralToken);
        String condition = LedgerHashes.normalizeBytes32(conditionId);
        LedgerHashes.requireWord(parentSlotId, "parentSlotId");
        LedgerHashes.requireWord(amount, "amount");

        executor.run("mergePosition", tx -> {
            int outcomeSlotCount = requirePrepared(condition);

            for (int i = 0; i < outcomeSlotCount; i++) {
                BigInteger slotId = SlotIdDeriver.getPayoutSlotId(parentSlotId, condition, i);
                balances.debit(tx, stakeholder, SlotIdDeriver.getPositionId(collateral, slotId), amount);
            }
            payOut(tx, stakeholder, collateral, parentSlotId, amount);

            tx.emit(PositionMerge.builder()
                    .stakeholder(stakeholder)
                    .collateralToken(collateral)
                    .parentSlotId(parentSlotId)
                    .conditionId(condition)
                    .amount(amount)
                    .build());
            log.debug("Merged {} of {} back into slot {} from {}", amount, collateral, parentSlotId, condition);
        });
    }

    /**
     * Burns the caller's outcome positions under {@code parentSlotId} and pays out their share.
     * Truncated remainders stay in custody.
     *
     * @return total paid, zero when there was nothing to redeem
     */
    public BigInteger redeemPayout(String caller, String collateralToken, BigInteger parentSlotId,
            String conditionId) {
        String redeemer = LedgerHashes.normalizeAddress(caller);
        String collateral = LedgerHashes.normalizeAddress(collateralToken);
        String condition = LedgerHashes.normalizeBytes32(conditionId);
        LedgerHashes.requireWord(parentSlotId, "parentSlotId");

        return executor.execute("redeemPayout", tx -> {
            Resolution resolution = registry.resolution(condition)
                    .orElseThrow(() -> new LedgerException(LedgerError.RESULT_NOT_RECEIVED, condition));
            int outcomeSlotCount = requirePrepared(condition);

            BigInteger totalPayout = BigInteger.ZERO;
            for (int i = 0; i < outcomeSlotCount; i++) {
                BigInteger slotId = SlotIdDeriver.getPayoutSlotId(parentSlotId, condition, i);
                BigInteger balance = balances.drain(tx, redeemer, SlotIdDeriver.getPositionId(collateral, slotId));
                if (balance.signum() != 0) {
                    totalPayout = totalPayout.add(resolution.payoutFor(i, balance));
                }
            }
            if (totalPayout.signum() != 0) {
                payOut(tx, redeemer, collateral, parentSlotId, totalPayout);
            }

            tx.emit(PayoutRedemption.builder()
                    .redeemer(redeemer)
                    .collateralToken(collateral)
                    .parentSlotId(parentSlotId)
                    .conditionId(condition)
                    .payout(totalPayout)
                    .build());
            log.debug("Redeemed {} of {} for {} on {}", totalPayout, collateral, redeemer, condition);
            return totalPayout;
        });
    }

    public BigInteger collateralInCustody(String collateralToken) {
        String collateral = LedgerHashes.normalizeAddress(collateralToken);
        return executor.read(() -> custody.held(collateral));
    }

    private int requirePrepared(String conditionId) {
        int outcomeSlotCount = registry.outcomeSlotCount(conditionId);
        if (outcomeSlotCount == 0) {
            throw new LedgerException(LedgerError.CONDITION_NOT_PREPARED, conditionId);
        }
        return outcomeSlotCount;
    }

    private void payOut(LedgerTransaction tx, String account, String collateral, BigInteger parentSlotId,
            BigInteger amount) {
        if (SlotIdDeriver.isRoot(parentSlotId)) {
            custody.pay(tx, collateral, account, amount);
        } else {
            balances.credit(tx, account, SlotIdDeriver.getPositionId(collateral, parentSlotId), amount);
        }
    }
}
