package org.nowstart.lending.service.ledger;

import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.lending.data.exception.LendingException;
import org.nowstart.lending.data.type.LendingErrorCode;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Non-reentrant mutual exclusion for ledger mutations. A second entry from the thread that
 * is still inside a guarded operation (a token hook or swap callback calling back into the
 * ledger) is rejected; other threads wait their turn.
 *
 * <p>Inside a transaction the lock outlives the permit and is released after the transaction
 * completes, so the next caller only reads committed state. Sequential operations of the
 * same transaction (the leverage loop) may enter again once the previous permit is closed.
 */
@Slf4j
@Component
public class LedgerGuard {

    private final ReentrantLock lock = new ReentrantLock();
    private final ThreadLocal<String> activeOperation = new ThreadLocal<>();

    public Permit enter(String operation) {
        String active = activeOperation.get();
        if (active != null) {
            log.warn("event=reentrant_call operation={} active_operation={}", operation, active);
            throw new LendingException(
                    LendingErrorCode.REENTRANT_CALL,
                    "Reentrant call to " + operation + " during " + active
            );
        }
        lock.lock();
        activeOperation.set(operation);
        return new Permit();
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    public final class Permit implements AutoCloseable {

        private boolean released;

        private Permit() {
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            activeOperation.remove();
            if (TransactionSynchronizationManager.isSynchronizationActive()) {
                TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                    @Override
                    public void afterCompletion(int status) {
                        lock.unlock();
                    }
                });
                return;
            }
            lock.unlock();
        }
    }
}
