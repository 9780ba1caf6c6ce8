package com.polymarket.ctf.core;

import com.polymarket.ctf.config.LedgerProperties;
import com.polymarket.ctf.domain.LedgerError;
import com.polymarket.ctf.domain.LedgerException;
import com.polymarket.ctf.infra.CollateralToken;
import com.polymarket.ctf.infra.CollateralTokenRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Moves collateral between accounts and the ledger's custody account and keeps count of what is
 * held per collateral token.
 * <p>
 * Token calls cannot be undone, so callers make them the last step of an operation, and they are
 * refused inside a savepoint, where the enclosing operation could still abort after them.
 */
@Slf4j
@Component
public class CollateralCustody {

    private final CollateralTokenRegistry tokens;
    private final String custodyAddress;
    private final Map<String, BigInteger> held = new HashMap<>();

    public CollateralCustody(CollateralTokenRegistry tokens, LedgerProperties properties) {
        this.tokens = tokens;
        this.custodyAddress = LedgerHashes.normalizeAddress(properties.custodyAddress());
    }

    public String getCustodyAddress() {
        return custodyAddress;
    }

    public BigInteger held(String collateralToken) {
        return held.getOrDefault(collateralToken, BigInteger.ZERO);
    }

    void pull(LedgerTransaction tx, String collateralToken, String payer, BigInteger amount) {
        requireOutermost(tx, "transferFrom " + payer, collateralToken);
        CollateralToken token = resolve(collateralToken);
        boolean ok = invoke(collateralToken, () -> token.transferFrom(custodyAddress, payer, custodyAddress, amount));
        if (!ok) {
            throw new LedgerException(LedgerError.COLLATERAL_TRANSFER_FAILED,
                    "transferFrom " + payer + " amount=" + amount + " token=" + collateralToken);
        }
        adjust(tx, collateralToken, amount);
        log.debug("Pulled {} of {} from {} into custody", amount, collateralToken, payer);
    }

    void pay(LedgerTransaction tx, String collateralToken, String payee, BigInteger amount) {
        requireOutermost(tx, "transfer to " + payee, collateralToken);
        CollateralToken token = resolve(collateralToken);
        boolean ok = invoke(collateralToken, () -> token.transfer(custodyAddress, payee, amount));
        if (!ok) {
            throw new LedgerException(LedgerError.COLLATERAL_TRANSFER_FAILED,
                    "transfer to " + payee + " amount=" + amount + " token=" + collateralToken);
        }
        adjust(tx, collateralToken, amount.negate());
        log.debug("Paid {} of {} from custody to {}", amount, collateralToken, payee);
    }

    private void requireOutermost(LedgerTransaction tx, String call, String collateralToken) {
        if (tx.isNested()) {
            throw new LedgerException(LedgerError.COLLATERAL_TRANSFER_FAILED,
                    call + " token=" + collateralToken + " attempted from a re-entrant call");
        }
    }

    private CollateralToken resolve(String collateralToken) {
        return tokens.find(collateralToken)
                .orElseThrow(() -> new LedgerException(LedgerError.COLLATERAL_TRANSFER_FAILED,
                        "unknown collateral token " + collateralToken));
    }

    private boolean invoke(String collateralToken, BooleanSupplier call) {
        try {
            return call.getAsBoolean();
        } catch (RuntimeException e) {
            throw new LedgerException(LedgerError.COLLATERAL_TRANSFER_FAILED,
                    "token " + collateralToken + " threw " + e.getMessage(), e);
        }
    }

    private void adjust(LedgerTransaction tx, String collateralToken, BigInteger delta) {
        BigInteger previous = held(collateralToken);
        held.put(collateralToken, previous.add(delta));
        tx.onRollback(() -> held.put(collateralToken, previous));
    }
}
