package com.polymarket.ctf.infra;

import com.polymarket.ctf.core.LedgerHashes;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Addresses that behave like contracts. Anything not registered is a plain account.
 */
public class ReceiverRegistry {

    private final ConcurrentHashMap<String, PositionReceiver> receivers = new ConcurrentHashMap<>();

    public void register(String address, PositionReceiver receiver) {
        receivers.put(LedgerHashes.normalizeAddress(address), receiver);
    }

    public void unregister(String address) {
        receivers.remove(LedgerHashes.normalizeAddress(address));
    }

    public Optional<PositionReceiver> find(String address) {
        return Optional.ofNullable(receivers.get(LedgerHashes.normalizeAddress(address)));
    }
}
