package com.polymarket.ctf.core;

import com.polymarket.ctf.domain.LedgerError;
import com.polymarket.ctf.domain.LedgerException;
import com.polymarket.ctf.domain.event.Approval;
import com.polymarket.ctf.domain.event.Transfer;
import com.polymarket.ctf.infra.PositionReceiver;
import com.polymarket.ctf.infra.ReceiverRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Token view of the position balances: every position id is an asset id that can be transferred
 * and approved like a multi-token balance.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MultiAssetLedger {

    private final LedgerExecutor executor;
    private final PositionBalances balances;
    private final AllowanceBook allowances;
    private final ReceiverRegistry receivers;

    public void transfer(String caller, String from, String to, BigInteger id, BigInteger value) {
        String operator = LedgerHashes.normalizeAddress(caller);
        String owner = LedgerHashes.normalizeAddress(from);
        String recipient = LedgerHashes.normalizeAddress(to);
        requireAmount(id, value);

        executor.run("transfer", tx -> move(tx, operator, owner, recipient, id, value));
    }

    /**
     * Transfers and, when the recipient is a registered receiver, requires it to acknowledge.
     * A missing or wrong acknowledgment undoes the transfer.
     */
    public void safeTransfer(String caller, String from, String to, BigInteger id, BigInteger value, byte[] data) {
        String operator = LedgerHashes.normalizeAddress(caller);
        String owner = LedgerHashes.normalizeAddress(from);
        String recipient = LedgerHashes.normalizeAddress(to);
        requireAmount(id, value);
        byte[] payload = data == null ? new byte[0] : data.clone();

        executor.run("safeTransfer", tx -> {
            move(tx, operator, owner, recipient, id, value);
            Optional<PositionReceiver> receiver = receivers.find(recipient);
            if (receiver.isPresent()) {
                acknowledge(receiver.get(), operator, owner, recipient, id, value, payload);
            }
        });
    }

    public void batchTransfer(String caller, String from, String to, List<BigInteger> ids, List<BigInteger> values) {
        String operator = LedgerHashes.normalizeAddress(caller);
        String owner = LedgerHashes.normalizeAddress(from);
        String recipient = LedgerHashes.normalizeAddress(to);
        requireSameLength(ids, values);
        for (int i = 0; i < ids.size(); i++) {
            requireAmount(ids.get(i), values.get(i));
        }

        executor.run("batchTransfer", tx -> {
            for (int i = 0; i < ids.size(); i++) {
                move(tx, operator, owner, recipient, ids.get(i), values.get(i));
            }
        });
    }

    /**
     * Sets the spender's allowance to {@code newValue}. Unless the new value is zero the live
     * allowance must still be {@code currentValue}, so a spender cannot slip in a spend between
     * reading and changing it.
     */
    public void approve(String caller, String spender, BigInteger id, BigInteger currentValue, BigInteger newValue) {
        String owner = LedgerHashes.normalizeAddress(caller);
        String approved = LedgerHashes.normalizeAddress(spender);
        requireAmount(id, newValue);

        executor.run("approve", tx -> setAllowance(tx, owner, approved, id, currentValue, newValue));
    }

    public void batchApprove(String caller, String spender, List<BigInteger> ids,
            List<BigInteger> currentValues, List<BigInteger> newValues) {
        String owner = LedgerHashes.normalizeAddress(caller);
        String approved = LedgerHashes.normalizeAddress(spender);
        requireSameLength(ids, currentValues);
        requireSameLength(ids, newValues);
        for (int i = 0; i < ids.size(); i++) {
            requireAmount(ids.get(i), newValues.get(i));
        }

        executor.run("batchApprove", tx -> {
            for (int i = 0; i < ids.size(); i++) {
                setAllowance(tx, owner, approved, ids.get(i), currentValues.get(i), newValues.get(i));
            }
        });
    }

    public BigInteger balanceOf(String owner, BigInteger id) {
        String account = LedgerHashes.normalizeAddress(owner);
        return executor.read(() -> balances.balanceOf(account, id));
    }

    public BigInteger allowance(BigInteger id, String owner, String spender) {
        String account = LedgerHashes.normalizeAddress(owner);
        String approved = LedgerHashes.normalizeAddress(spender);
        return executor.read(() -> allowances.allowance(id, account, approved));
    }

    private void move(LedgerTransaction tx, String operator, String from, String to, BigInteger id, BigInteger value) {
        if (!operator.equals(from)) {
            allowances.consume(tx, id, from, operator, value);
        }
        balances.debit(tx, from, id, value);
        balances.credit(tx, to, id, value);
        tx.emit(Transfer.builder()
                .operator(operator)
                .from(from)
                .to(to)
                .id(id)
                .value(value)
                .build());
        log.debug("Moved {} of position {} from {} to {} (operator {})", value, id, from, to, operator);
    }

    private void setAllowance(LedgerTransaction tx, String owner, String spender, BigInteger id,
            BigInteger currentValue, BigInteger newValue) {
        BigInteger live = allowances.allowance(id, owner, spender);
        if (newValue.signum() != 0 && !live.equals(currentValue)) {
            throw new LedgerException(LedgerError.STALE_APPROVAL,
                    "id=" + id + " owner=" + owner + " spender=" + spender + " expected=" + currentValue + " live=" + live);
        }
        allowances.set(tx, id, owner, spender, newValue);
        tx.emit(Approval.builder()
                .owner(owner)
                .spender(spender)
                .id(id)
                .oldValue(live)
                .value(newValue)
                .build());
    }

    private void acknowledge(PositionReceiver receiver, String operator, String from, String to,
            BigInteger id, BigInteger value, byte[] data) {
        byte[] reply;
        try {
            reply = receiver.onERC1155Received(operator, from, id, value, data);
        } catch (RuntimeException e) {
            throw new LedgerException(LedgerError.TRANSFER_REJECTED_BY_RECEIVER,
                    "receiver " + to + " threw " + e.getMessage(), e);
        }
        if (!Arrays.equals(PositionReceiver.ACCEPTED, reply)) {
            throw new LedgerException(LedgerError.TRANSFER_REJECTED_BY_RECEIVER, "receiver " + to);
        }
    }

    private static void requireAmount(BigInteger id, BigInteger value) {
        LedgerHashes.requireWord(id, "id");
        LedgerHashes.requireWord(value, "value");
    }

    private static void requireSameLength(List<?> a, List<?> b) {
        if (a.size() != b.size()) {
            throw new IllegalArgumentException("Array lengths differ: " + a.size() + " != " + b.size());
        }
    }
}
