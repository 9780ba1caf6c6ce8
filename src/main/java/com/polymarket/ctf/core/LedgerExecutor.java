package com.polymarket.ctf.core;

import com.polymarket.ctf.domain.LedgerException;
import com.polymarket.ctf.domain.event.LedgerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs ledger operations one at a time, each inside its own {@link LedgerTransaction}.
 * <p>
 * An operation either commits every write and publishes its events, or throws and leaves no trace.
 * Calls made from inside a running operation (receiver callbacks re-entering the ledger) become
 * savepoints of the enclosing transaction. A publisher failure after commit is logged and does not
 * stop the remaining events from going out.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerExecutor {

    private final LedgerEventPublisher publisher;
    private final ReentrantLock lock = new ReentrantLock();
    private LedgerTransaction current;

    public <T> T execute(String operation, Function<LedgerTransaction, T> body) {
        lock.lock();
        try {
            LedgerTransaction tx = new LedgerTransaction(current);
            current = tx;
            T result;
            try {
                result = body.apply(tx);
            } catch (RuntimeException | Error e) {
                current = tx.parent();
                tx.rollback();
                if (e instanceof LedgerException) {
                    log.warn("{} aborted [{}]: {}", operation, ((LedgerException) e).getError(), e.getMessage());
                } else {
                    log.warn("{} aborted: {}", operation, e.toString());
                }
                throw e;
            }
            current = tx.parent();

            if (tx.parent() != null) {
                tx.mergeIntoParent();
                return result;
            }
            List<LedgerEvent> committed = tx.events();
            log.debug("{} committed with {} event(s)", operation, committed.size());
            for (LedgerEvent event : committed) {
                try {
                    publisher.publish(event);
                } catch (RuntimeException e) {
                    log.error("{} committed but publishing {} failed", operation, event, e);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public void run(String operation, Consumer<LedgerTransaction> body) {
        execute(operation, tx -> {
            body.accept(tx);
            return null;
        });
    }

    /**
     * Evaluates a read-only query against a consistent view of the ledger.
     */
    public <T> T read(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }
}
