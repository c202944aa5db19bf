package com.vaultledger.common;

import com.vaultledger.common.exception.LedgerBusyException;
import com.vaultledger.common.exception.ReentrantCallException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs every mutating ledger operation as one serialized unit of work.
 *
 * The guard takes a single fair lock, then opens a transaction, so the lock
 * spans the whole transaction including commit. A thread that is already
 * inside an operation (for example a transfer hook calling back into the
 * ledger) is rejected instead of being allowed to re-enter.
 */
@Component
@Slf4j
public class OperationGuard {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final TransactionTemplate transactionTemplate;
    private final long lockTimeoutMillis;

    private volatile String currentOperation;

    public OperationGuard(
            PlatformTransactionManager transactionManager,
            @Value("${vault-ledger.operation.lock-timeout-ms:5000}") long lockTimeoutMillis) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.lockTimeoutMillis = lockTimeoutMillis;
    }

    /**
     * Execute {@code body} exclusively and atomically.
     *
     * @param operation name used in logs and errors
     * @param body the unit of work; any exception rolls it back
     * @return whatever the body returns
     * @throws ReentrantCallException if called from inside another operation on this thread
     * @throws LedgerBusyException if the lock is not acquired within the timeout
     */
    public <T> T run(String operation, Supplier<T> body) {
        if (lock.isHeldByCurrentThread()) {
            throw new ReentrantCallException(operation, currentOperation);
        }

        acquire(operation);
        try {
            currentOperation = operation;
            log.debug("Starting ledger operation {}", operation);
            return transactionTemplate.execute(status -> body.get());
        } finally {
            currentOperation = null;
            lock.unlock();
        }
    }

    public boolean isOperationInProgress() {
        return lock.isLocked();
    }

    private void acquire(String operation) {
        try {
            if (!lock.tryLock(lockTimeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new LedgerBusyException(operation);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerBusyException(operation);
        }
    }
}
