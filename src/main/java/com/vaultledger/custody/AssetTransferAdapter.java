package com.vaultledger.custody;

import java.math.BigInteger;

/**
 * Currency rail between holders' wallets and the ledger.
 *
 * The ledger calls this only after its own state has been updated, so any
 * callback into the ledger during a transfer observes the post-operation state
 * (and is rejected by the operation guard).
 *
 * Each transfer is atomic: it either completes or throws with nothing moved.
 */
public interface AssetTransferAdapter {

    /**
     * Pull currency from a holder's wallet into the ledger.
     *
     * @throws com.vaultledger.common.exception.InsufficientFundsException if the wallet cannot cover it
     * @throws CustodyException if the rail fails
     */
    void collect(String from, BigInteger amount);

    /**
     * Pay currency from the ledger to a holder's wallet.
     *
     * @throws CustodyException if the rail fails
     */
    void pay(String to, BigInteger amount);

    String getAdapterName();
}
