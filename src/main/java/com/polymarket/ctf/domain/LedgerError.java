package com.polymarket.ctf.domain;

/**
 * Reasons a ledger operation can abort. Every code is a hard failure: the operation that raised it
 * leaves no state change behind.
 */
public enum LedgerError {
    ALREADY_PREPARED("Condition already prepared"),
    INVALID_OUTCOME_SLOT_COUNT("Condition needs at least one outcome slot"),
    MALFORMED_RESULT("Result must be a non-empty sequence of 32-byte words"),
    OUTCOME_COUNT_MISMATCH("Condition not prepared with this outcome slot count"),
    ALREADY_RESOLVED("Condition already resolved"),
    PAYOUT_ALREADY_SET("Payout numerator already set"),
    ALL_ZERO_PAYOUT("Payout vector is all zeroes"),
    PAYOUT_DENOMINATOR_OVERFLOW("Payout numerators sum past 2^256 - 1"),
    CONDITION_NOT_PREPARED("Condition not prepared"),
    RESULT_NOT_RECEIVED("Result for condition not received yet"),
    INSUFFICIENT_BALANCE("Insufficient position balance"),
    BALANCE_OVERFLOW("Position balance overflow"),
    INSUFFICIENT_ALLOWANCE("Insufficient allowance"),
    STALE_APPROVAL("Current allowance does not match expected value"),
    COLLATERAL_TRANSFER_FAILED("Collateral transfer failed"),
    TRANSFER_REJECTED_BY_RECEIVER("Receiver did not acknowledge transfer");

    private final String description;

    LedgerError(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
