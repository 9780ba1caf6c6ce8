package com.polymarket.ctf.core;

import com.polymarket.ctf.domain.event.LedgerEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Undo journal and event buffer for one atomic ledger operation.
 * <p>
 * Stores register an undo action for every write. Rolling back replays them newest first, so the
 * ledger ends up exactly as it was before the operation started.
 */
public final class LedgerTransaction {

    private final LedgerTransaction parent;
    private final Deque<Runnable> undoLog = new ArrayDeque<>();
    private final List<LedgerEvent> events = new ArrayList<>();

    LedgerTransaction(LedgerTransaction parent) {
        this.parent = parent;
    }

    public void onRollback(Runnable undo) {
        undoLog.push(undo);
    }

    public void emit(LedgerEvent event) {
        events.add(event);
    }

    /**
     * True for a savepoint opened by a call that re-entered the ledger.
     */
    boolean isNested() {
        return parent != null;
    }

    LedgerTransaction parent() {
        return parent;
    }

    List<LedgerEvent> events() {
        return Collections.unmodifiableList(events);
    }

    void rollback() {
        while (!undoLog.isEmpty()) {
            undoLog.pop().run();
        }
        events.clear();
    }

    /**
     * Hands this savepoint's journal and events to the enclosing transaction.
     */
    void mergeIntoParent() {
        // parent's undo log is a stack: push oldest first so newest ends on top
        while (!undoLog.isEmpty()) {
            parent.undoLog.push(undoLog.pollLast());
        }
        parent.events.addAll(events);
        events.clear();
    }
}
