package com.polymarket.ctf.core;

import com.polymarket.ctf.domain.Condition;
import com.polymarket.ctf.domain.LedgerError;
import com.polymarket.ctf.domain.LedgerException;
import com.polymarket.ctf.domain.Resolution;
import com.polymarket.ctf.domain.event.ConditionPreparation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Condition table plus the payout numerator and denominator tables that resolution fills in.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConditionRegistry {

    private final LedgerExecutor executor;

    private final Map<String, Condition> conditions = new HashMap<>();
    private final Map<String, BigInteger[]> payoutNumerators = new HashMap<>();
    private final Map<String, BigInteger> payoutDenominator = new HashMap<>();

    public String prepareCondition(String oracle, String questionId, int outcomeSlotCount) {
        String normalizedOracle = LedgerHashes.normalizeAddress(oracle);
        String normalizedQuestion = LedgerHashes.normalizeBytes32(questionId);
        if (outcomeSlotCount < 1) {
            throw new LedgerException(LedgerError.INVALID_OUTCOME_SLOT_COUNT, "outcomeSlotCount=" + outcomeSlotCount);
        }
        String conditionId = LedgerHashes.conditionId(normalizedOracle, normalizedQuestion, outcomeSlotCount);

        return executor.execute("prepareCondition", tx -> {
            if (payoutNumerators.containsKey(conditionId)) {
                throw new LedgerException(LedgerError.ALREADY_PREPARED, conditionId);
            }
            BigInteger[] numerators = new BigInteger[outcomeSlotCount];
            Arrays.fill(numerators, BigInteger.ZERO);
            payoutNumerators.put(conditionId, numerators);
            conditions.put(conditionId, Condition.builder()
                    .conditionId(conditionId)
                    .oracle(normalizedOracle)
                    .questionId(normalizedQuestion)
                    .outcomeSlotCount(outcomeSlotCount)
                    .build());
            tx.onRollback(() -> {
                payoutNumerators.remove(conditionId);
                conditions.remove(conditionId);
            });

            tx.emit(ConditionPreparation.builder()
                    .conditionId(conditionId)
                    .oracle(normalizedOracle)
                    .questionId(normalizedQuestion)
                    .outcomeSlotCount(outcomeSlotCount)
                    .build());
            log.info("Prepared condition {} (oracle={}, question={}, outcomes={})",
                    conditionId, normalizedOracle, normalizedQuestion, outcomeSlotCount);
            return conditionId;
        });
    }

    /**
     * Declared outcome count, or 0 when the condition was never prepared.
     */
    public int getOutcomeSlotCount(String conditionId) {
        return executor.read(() -> outcomeSlotCount(conditionId));
    }

    public Optional<Condition> getCondition(String conditionId) {
        return executor.read(() -> Optional.ofNullable(conditions.get(conditionId)));
    }

    public Optional<Resolution> getResolution(String conditionId) {
        return executor.read(() -> resolution(conditionId));
    }

    public BigInteger payoutNumerator(String conditionId, int index) {
        return executor.read(() -> {
            BigInteger[] numerators = payoutNumerators.get(conditionId);
            if (numerators == null || index < 0 || index >= numerators.length) {
                return BigInteger.ZERO;
            }
            return numerators[index];
        });
    }

    public BigInteger payoutDenominator(String conditionId) {
        return executor.read(() -> denominator(conditionId));
    }

    public int conditionCount() {
        return executor.read(conditions::size);
    }

    int outcomeSlotCount(String conditionId) {
        BigInteger[] numerators = payoutNumerators.get(conditionId);
        return numerators == null ? 0 : numerators.length;
    }

    BigInteger denominator(String conditionId) {
        return payoutDenominator.getOrDefault(conditionId, BigInteger.ZERO);
    }

    Optional<Resolution> resolution(String conditionId) {
        BigInteger denominator = denominator(conditionId);
        if (denominator.signum() == 0) {
            return Optional.empty();
        }
        return Optional.of(Resolution.builder()
                .conditionId(conditionId)
                .payoutNumerators(List.of(payoutNumerators.get(conditionId)))
                .payoutDenominator(denominator)
                .build());
    }

    Condition condition(String conditionId) {
        return conditions.get(conditionId);
    }

    /**
     * Writes one numerator; the slot has to be unset.
     */
    void recordNumerator(LedgerTransaction tx, String conditionId, int index, BigInteger numerator) {
        BigInteger[] numerators = payoutNumerators.get(conditionId);
        if (numerators[index].signum() != 0) {
            throw new LedgerException(LedgerError.PAYOUT_ALREADY_SET, conditionId + "[" + index + "]");
        }
        numerators[index] = numerator;
        tx.onRollback(() -> numerators[index] = BigInteger.ZERO);
    }

    void recordDenominator(LedgerTransaction tx, String conditionId, BigInteger denominator) {
        payoutDenominator.put(conditionId, denominator);
        tx.onRollback(() -> payoutDenominator.remove(conditionId));
    }
}
