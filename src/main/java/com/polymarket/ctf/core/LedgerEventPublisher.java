package com.polymarket.ctf.core;

import com.polymarket.ctf.domain.event.LedgerEvent;

/**
 * Receives events after the operation that produced them has committed.
 */
@FunctionalInterface
public interface LedgerEventPublisher {

    void publish(LedgerEvent event);
}
