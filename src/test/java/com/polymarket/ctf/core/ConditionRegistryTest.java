package com.polymarket.ctf.core;

import com.polymarket.ctf.domain.Condition;
import com.polymarket.ctf.domain.LedgerError;
import com.polymarket.ctf.domain.LedgerException;
import com.polymarket.ctf.domain.event.ConditionPreparation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConditionRegistryTest {

    private LedgerFixture ledger;

    @BeforeEach
    void setUp() {
        ledger = new LedgerFixture();
    }

    @Test
    void prepareStoresConditionAndEmitsEvent() {
        String conditionId = ledger.prepare("Q1", 3);

        assertEquals(LedgerHashes.conditionId(LedgerFixture.ORACLE, LedgerFixture.question("Q1"), 3), conditionId);
        assertEquals(3, ledger.registry.getOutcomeSlotCount(conditionId));

        Condition condition = ledger.registry.getCondition(conditionId).orElseThrow();
        assertEquals(LedgerFixture.ORACLE, condition.getOracle());
        assertEquals(LedgerFixture.question("Q1"), condition.getQuestionId());

        ConditionPreparation event = ledger.events(ConditionPreparation.class).get(0);
        assertEquals(conditionId, event.getConditionId());
        assertEquals(3, event.getOutcomeSlotCount());
        assertEquals(LedgerFixture.ORACLE, event.getOracle());
    }

    @Test
    void unknownConditionHasZeroOutcomeSlots() {
        String unknown = LedgerHashes.conditionId(LedgerFixture.ORACLE, LedgerFixture.question("never"), 2);

        assertEquals(0, ledger.registry.getOutcomeSlotCount(unknown));
        assertTrue(ledger.registry.getCondition(unknown).isEmpty());
        assertEquals(BigInteger.ZERO, ledger.registry.payoutDenominator(unknown));
    }

    @Test
    void preparingTwiceFails() {
        ledger.prepare("Q1", 2);

        LedgerException e = assertThrows(LedgerException.class, () -> ledger.prepare("Q1", 2));
        assertEquals(LedgerError.ALREADY_PREPARED, e.getError());
        assertEquals(1, ledger.events(ConditionPreparation.class).size());
        assertEquals(1, ledger.registry.conditionCount());
    }

    @Test
    void sameQuestionWithAnotherOutcomeCountIsADifferentCondition() {
        String two = ledger.prepare("Q1", 2);
        String three = ledger.prepare("Q1", 3);

        assertNotEquals(two, three);
        assertEquals(2, ledger.registry.conditionCount());
    }

    @Test
    void rejectsConditionWithoutOutcomeSlots() {
        LedgerException e = assertThrows(LedgerException.class, () -> ledger.prepare("Q1", 0));

        assertEquals(LedgerError.INVALID_OUTCOME_SLOT_COUNT, e.getError());
        assertTrue(ledger.events.isEmpty());
    }

    @Test
    void unresolvedConditionHasZeroedNumerators() {
        String conditionId = ledger.prepare("Q1", 2);

        assertEquals(BigInteger.ZERO, ledger.registry.payoutNumerator(conditionId, 0));
        assertEquals(BigInteger.ZERO, ledger.registry.payoutNumerator(conditionId, 1));
        assertTrue(ledger.registry.getResolution(conditionId).isEmpty());
    }
}
