package com.polymarket.ctf.core;

import com.polymarket.ctf.domain.LedgerError;
import com.polymarket.ctf.domain.LedgerException;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Per asset id allowances: id, then owner, then spender.
 */
@Component
public class AllowanceBook {

    private final Map<BigInteger, Map<String, Map<String, BigInteger>>> allowances = new HashMap<>();

    public BigInteger allowance(BigInteger id, String owner, String spender) {
        Map<String, BigInteger> spenders = allowances
                .getOrDefault(id, Map.of())
                .get(owner);
        if (spenders == null) {
            return BigInteger.ZERO;
        }
        return spenders.getOrDefault(spender, BigInteger.ZERO);
    }

    void consume(LedgerTransaction tx, BigInteger id, String owner, String spender, BigInteger amount) {
        BigInteger allowed = allowance(id, owner, spender);
        if (allowed.compareTo(amount) < 0) {
            throw new LedgerException(LedgerError.INSUFFICIENT_ALLOWANCE,
                    "id=" + id + " owner=" + owner + " spender=" + spender + " allowance=" + allowed + " requested=" + amount);
        }
        set(tx, id, owner, spender, allowed.subtract(amount));
    }

    void set(LedgerTransaction tx, BigInteger id, String owner, String spender, BigInteger value) {
        BigInteger previous = allowance(id, owner, spender);
        put(id, owner, spender, value);
        tx.onRollback(() -> put(id, owner, spender, previous));
    }

    private void put(BigInteger id, String owner, String spender, BigInteger value) {
        allowances.computeIfAbsent(id, k -> new HashMap<>())
                .computeIfAbsent(owner, k -> new HashMap<>())
                .put(spender, value);
    }
}
