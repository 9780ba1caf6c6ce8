package com.polymarket.ctf.domain.event;

/**
 * Marker for everything the ledger emits to off-chain observers.
 */
public interface LedgerEvent {
}
