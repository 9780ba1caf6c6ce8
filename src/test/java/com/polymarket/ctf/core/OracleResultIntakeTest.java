package com.polymarket.ctf.core;

import com.polymarket.ctf.domain.LedgerError;
import com.polymarket.ctf.domain.LedgerException;
import com.polymarket.ctf.domain.Resolution;
import com.polymarket.ctf.domain.event.ConditionResolution;
import com.polymarket.ctf.infra.PayoutResultCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.List;

import static com.polymarket.ctf.core.LedgerFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class OracleResultIntakeTest {

    private LedgerFixture ledger;
    private String conditionId;

    @BeforeEach
    void setUp() {
        ledger = new LedgerFixture();
        conditionId = ledger.prepare("Q1", 2);
    }

    @Test
    void recordsPayoutVectorAndDenominator() {
        byte[] result = PayoutResultCodec.encode(1, 3);

        assertEquals(conditionId, ledger.intake.receiveResult(ORACLE, question("Q1"), result));

        Resolution resolution = ledger.registry.getResolution(conditionId).orElseThrow();
        assertEquals(List.of(units(1), units(3)), resolution.getPayoutNumerators());
        assertEquals(units(4), resolution.getPayoutDenominator());
        assertEquals(units(3), ledger.registry.payoutNumerator(conditionId, 1));

        ConditionResolution event = ledger.events(ConditionResolution.class).get(0);
        assertEquals(conditionId, event.getConditionId());
        assertEquals(ORACLE, event.getOracle());
        assertEquals(2, event.getOutcomeSlotCount());
        assertEquals(Numeric.toHexString(result), event.getResult());
    }

    @Test
    void rejectsResultThatIsNotWholeWords() {
        assertError(LedgerError.MALFORMED_RESULT, () -> ledger.intake.receiveResult(ORACLE, question("Q1"), new byte[0]));
        assertError(LedgerError.MALFORMED_RESULT, () -> ledger.intake.receiveResult(ORACLE, question("Q1"), new byte[33]));
    }

    @Test
    void impostorTargetsAnUnpreparedCondition() {
        assertError(LedgerError.OUTCOME_COUNT_MISMATCH,
                () -> ledger.intake.receiveResult(ALICE, question("Q1"), PayoutResultCodec.encode(1, 0)));
        assertEquals(BigInteger.ZERO, ledger.registry.payoutDenominator(conditionId));
    }

    @Test
    void rejectsWrongOutcomeCount() {
        assertError(LedgerError.OUTCOME_COUNT_MISMATCH,
                () -> ledger.intake.receiveResult(ORACLE, question("Q1"), PayoutResultCodec.encode(1, 0, 0)));
    }

    @Test
    void resolutionIsWriteOnce() {
        ledger.intake.receiveResult(ORACLE, question("Q1"), PayoutResultCodec.encode(1, 0));

        assertError(LedgerError.ALREADY_RESOLVED,
                () -> ledger.intake.receiveResult(ORACLE, question("Q1"), PayoutResultCodec.encode(0, 1)));
        assertEquals(List.of(units(1), units(0)),
                ledger.registry.getResolution(conditionId).orElseThrow().getPayoutNumerators());
        assertEquals(1, ledger.events(ConditionResolution.class).size());
    }

    @Test
    void allZeroReportLeavesConditionOpen() {
        assertError(LedgerError.ALL_ZERO_PAYOUT,
                () -> ledger.intake.receiveResult(ORACLE, question("Q1"), PayoutResultCodec.encode(0, 0)));
        assertTrue(ledger.registry.getResolution(conditionId).isEmpty());
        assertTrue(ledger.events(ConditionResolution.class).isEmpty());

        ledger.intake.receiveResult(ORACLE, question("Q1"), PayoutResultCodec.encode(0, 5));
        assertEquals(units(5), ledger.registry.payoutDenominator(conditionId));
    }

    @Test
    void denominatorMustFitInOneWord() {
        byte[] result = PayoutResultCodec.encode(List.of(LedgerHashes.MAX_WORD, BigInteger.ONE));

        assertError(LedgerError.PAYOUT_DENOMINATOR_OVERFLOW,
                () -> ledger.intake.receiveResult(ORACLE, question("Q1"), result));
        assertTrue(ledger.registry.getResolution(conditionId).isEmpty());
        assertEquals(BigInteger.ZERO, ledger.registry.payoutNumerator(conditionId, 0));
        assertTrue(ledger.events(ConditionResolution.class).isEmpty());

        ledger.intake.receiveResult(ORACLE, question("Q1"),
                PayoutResultCodec.encode(List.of(LedgerHashes.MAX_WORD, BigInteger.ZERO)));
        assertEquals(LedgerHashes.MAX_WORD, ledger.registry.payoutDenominator(conditionId));
    }

    @Test
    void numeratorSlotCannotBeOverwritten() {
        ledger.executor.run("seed", tx -> ledger.registry.recordNumerator(tx, conditionId, 0, units(1)));

        assertError(LedgerError.PAYOUT_ALREADY_SET,
                () -> ledger.executor.run("overwrite", tx -> ledger.registry.recordNumerator(tx, conditionId, 0, units(2))));
        assertEquals(units(1), ledger.registry.payoutNumerator(conditionId, 0));
    }

    private static void assertError(LedgerError expected, Runnable call) {
        LedgerException e = assertThrows(LedgerException.class, call::run);
        assertEquals(expected, e.getError());
    }
}
