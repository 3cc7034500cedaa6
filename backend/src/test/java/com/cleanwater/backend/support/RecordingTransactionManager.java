package com.cleanwater.backend.support;

import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;
import org.springframework.transaction.support.SmartTransactionObject;

/**
 * Resource-less transaction manager that follows Spring's propagation and rollback-only rules and
 * counts how each outer transaction ended.
 */
public class RecordingTransactionManager extends AbstractPlatformTransactionManager {

    private final ThreadLocal<TransactionState> current = new ThreadLocal<>();
    private int commits;
    private int rollbacks;

    public int getCommits() {
        return commits;
    }

    public int getRollbacks() {
        return rollbacks;
    }

    @Override
    protected Object doGetTransaction() {
        return new TransactionHandle(current.get());
    }

    @Override
    protected boolean isExistingTransaction(Object transaction) {
        return ((TransactionHandle) transaction).state != null;
    }

    @Override
    protected void doBegin(Object transaction, TransactionDefinition definition) {
        TransactionState state = new TransactionState();
        ((TransactionHandle) transaction).state = state;
        current.set(state);
    }

    @Override
    protected void doCommit(DefaultTransactionStatus status) {
        current.remove();
        commits++;
    }

    @Override
    protected void doRollback(DefaultTransactionStatus status) {
        current.remove();
        rollbacks++;
    }

    @Override
    protected void doSetRollbackOnly(DefaultTransactionStatus status) {
        ((TransactionHandle) status.getTransaction()).state.rollbackOnly = true;
    }

    private static final class TransactionState {
        private boolean rollbackOnly;
    }

    private static final class TransactionHandle implements SmartTransactionObject {

        private TransactionState state;

        private TransactionHandle(TransactionState state) {
            this.state = state;
        }

        @Override
        public boolean isRollbackOnly() {
            return state != null && state.rollbackOnly;
        }

        @Override
        public void flush() {
        }
    }
}
