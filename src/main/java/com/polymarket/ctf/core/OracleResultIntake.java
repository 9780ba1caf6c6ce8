package com.polymarket.ctf.core;

import com.polymarket.ctf.domain.Condition;
import com.polymarket.ctf.domain.LedgerError;
import com.polymarket.ctf.domain.LedgerException;
import com.polymarket.ctf.domain.event.ConditionResolution;
import com.polymarket.ctf.infra.PayoutResultCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.List;

/**
 * Accepts payout vectors from oracles.
 * <p>
 * The reporting address is part of the condition id, so a caller that is not the oracle lands on
 * an id that was never prepared and is turned away with {@link LedgerError#OUTCOME_COUNT_MISMATCH}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OracleResultIntake {

    private final LedgerExecutor executor;
    private final ConditionRegistry registry;

    public String receiveResult(String caller, String questionId, byte[] result) {
        String oracle = LedgerHashes.normalizeAddress(caller);
        String question = LedgerHashes.normalizeBytes32(questionId);
        List<BigInteger> numerators = PayoutResultCodec.decode(result);
        int outcomeSlotCount = numerators.size();
        String conditionId = LedgerHashes.conditionId(oracle, question, outcomeSlotCount);
        String resultHex = Numeric.toHexString(result);

        return executor.execute("receiveResult", tx -> {
            if (registry.outcomeSlotCount(conditionId) != outcomeSlotCount) {
                throw new LedgerException(LedgerError.OUTCOME_COUNT_MISMATCH,
                        "no condition " + conditionId + " with " + outcomeSlotCount + " outcome slots for oracle " + oracle);
            }
            if (registry.denominator(conditionId).signum() != 0) {
                throw new LedgerException(LedgerError.ALREADY_RESOLVED, conditionId);
            }

            BigInteger denominator = BigInteger.ZERO;
            for (int i = 0; i < outcomeSlotCount; i++) {
                BigInteger numerator = numerators.get(i);
                registry.recordNumerator(tx, conditionId, i, numerator);
                denominator = denominator.add(numerator);
            }
            if (denominator.signum() == 0) {
                throw new LedgerException(LedgerError.ALL_ZERO_PAYOUT, conditionId);
            }
            if (denominator.compareTo(LedgerHashes.MAX_WORD) > 0) {
                throw new LedgerException(LedgerError.PAYOUT_DENOMINATOR_OVERFLOW,
                        conditionId + " denominator " + denominator);
            }
            registry.recordDenominator(tx, conditionId, denominator);

            Condition condition = registry.condition(conditionId);
            tx.emit(ConditionResolution.builder()
                    .conditionId(conditionId)
                    .oracle(condition.getOracle())
                    .questionId(condition.getQuestionId())
                    .outcomeSlotCount(outcomeSlotCount)
                    .result(resultHex)
                    .build());
            log.info("Resolved condition {} with payouts {} / {}", conditionId, numerators, denominator);
            return conditionId;
        });
    }
}
