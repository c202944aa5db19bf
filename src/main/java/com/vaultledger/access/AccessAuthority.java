package com.vaultledger.access;

import com.vaultledger.common.exception.OperationPausedException;
import com.vaultledger.common.exception.UnauthorizedCallerException;

/**
 * Capability and pause-state authority consulted by every ledger operation.
 *
 * Role management itself lives outside the ledger; the ledger only asks who
 * the owner is, whether a caller is an operator, and which operation classes
 * are paused.
 */
public interface AccessAuthority {

    /**
     * Identity holding the owner capability (yield reports, parameters, emergency paths).
     */
    String owner();

    /**
     * Whether the identity may fulfill withdrawals and pause the ledger.
     */
    boolean isOperator(String identity);

    boolean paused();

    boolean depositsPaused();

    boolean withdrawalsPaused();

    void setPaused(String caller, boolean paused);

    void setDepositsPaused(String caller, boolean paused);

    void setWithdrawalsPaused(String caller, boolean paused);

    default boolean isOwner(String identity) {
        return identity != null && identity.equals(owner());
    }

    default void requireOwner(String caller, String operation) {
        if (!isOwner(caller)) {
            throw new UnauthorizedCallerException(caller, "OWNER", operation);
        }
    }

    /**
     * The owner implicitly holds the operator capability.
     */
    default void requireOperator(String caller, String operation) {
        if (!isOwner(caller) && !isOperator(caller)) {
            throw new UnauthorizedCallerException(caller, "OPERATOR", operation);
        }
    }

    default void requireDepositsOpen() {
        if (paused() || depositsPaused()) {
            throw new OperationPausedException("deposit");
        }
    }

    default void requireWithdrawalsOpen(String operation) {
        if (paused() || withdrawalsPaused()) {
            throw new OperationPausedException(operation);
        }
    }
}
