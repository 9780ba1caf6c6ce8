package com.polymarket.ctf.core;

import com.polymarket.ctf.domain.LedgerError;
import com.polymarket.ctf.domain.LedgerException;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * The single balance store behind both the split/merge/redeem engine and the token transfer layer.
 * Keyed like the on-chain mapping: position id, then owner.
 */
@Component
public class PositionBalances {

    private final Map<BigInteger, Map<String, BigInteger>> balances = new HashMap<>();

    public BigInteger balanceOf(String owner, BigInteger positionId) {
        Map<String, BigInteger> holders = balances.get(positionId);
        if (holders == null) {
            return BigInteger.ZERO;
        }
        return holders.getOrDefault(owner, BigInteger.ZERO);
    }

    void credit(LedgerTransaction tx, String owner, BigInteger positionId, BigInteger amount) {
        BigInteger updated = balanceOf(owner, positionId).add(amount);
        if (updated.compareTo(LedgerHashes.MAX_WORD) > 0) {
            throw new LedgerException(LedgerError.BALANCE_OVERFLOW,
                    "owner=" + owner + " position=" + positionId);
        }
        set(tx, owner, positionId, updated);
    }

    void debit(LedgerTransaction tx, String owner, BigInteger positionId, BigInteger amount) {
        BigInteger balance = balanceOf(owner, positionId);
        if (balance.compareTo(amount) < 0) {
            throw new LedgerException(LedgerError.INSUFFICIENT_BALANCE,
                    "owner=" + owner + " position=" + positionId + " balance=" + balance + " requested=" + amount);
        }
        set(tx, owner, positionId, balance.subtract(amount));
    }

    /**
     * Zeroes the balance and returns what it held.
     */
    BigInteger drain(LedgerTransaction tx, String owner, BigInteger positionId) {
        BigInteger balance = balanceOf(owner, positionId);
        if (balance.signum() != 0) {
            set(tx, owner, positionId, BigInteger.ZERO);
        }
        return balance;
    }

    private void set(LedgerTransaction tx, String owner, BigInteger positionId, BigInteger value) {
        BigInteger previous = balanceOf(owner, positionId);
        put(owner, positionId, value);
        tx.onRollback(() -> put(owner, positionId, previous));
    }

    private void put(String owner, BigInteger positionId, BigInteger value) {
        balances.computeIfAbsent(positionId, k -> new HashMap<>()).put(owner, value);
    }
}
