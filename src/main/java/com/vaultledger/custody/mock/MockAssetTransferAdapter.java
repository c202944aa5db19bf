package com.vaultledger.custody.mock;

import com.vaultledger.common.exception.InsufficientFundsException;
import com.vaultledger.custody.AssetTransferAdapter;
import com.vaultledger.custody.CustodyException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/**
 * Mock currency rail keeping holder wallets in memory.
 *
 * An optional transfer hook runs inside {@link #collect} and {@link #pay}; tests
 * use it to model a malicious token that calls back into the ledger. A hook that
 * throws reverts the transfer, like a token transfer that reverts.
 *
 * NOT FOR PRODUCTION.
 */
@Slf4j
public class MockAssetTransferAdapter implements AssetTransferAdapter {

    // wallet -> balance
    private final Map<String, BigInteger> wallets = new ConcurrentHashMap<>();

    private volatile BiConsumer<String, BigInteger> transferHook;

    private volatile String failingPayee;

    /**
     * Credit a wallet (helper for testing).
     */
    public void fund(String wallet, BigInteger amount) {
        wallets.merge(wallet, amount, BigInteger::add);
        log.debug("Mock wallet {} funded with {}", wallet, amount);
    }

    public BigInteger balanceOf(String wallet) {
        return wallets.getOrDefault(wallet, BigInteger.ZERO);
    }

    @Override
    public void collect(String from, BigInteger amount) {
        BigInteger balance = balanceOf(from);
        if (balance.compareTo(amount) < 0) {
            throw new InsufficientFundsException(from, amount, balance);
        }
        wallets.put(from, balance.subtract(amount));
        try {
            fireHook(from, amount);
        } catch (RuntimeException e) {
            wallets.merge(from, amount, BigInteger::add);
            throw e;
        }
        log.info("Mock rail: collected {} from {}", amount, from);
    }

    @Override
    public void pay(String to, BigInteger amount) {
        if (failingPayee != null && failingPayee.equals(to)) {
            throw new CustodyException("Mock rail rejected payout", to, "pay");
        }
        wallets.merge(to, amount, BigInteger::add);
        try {
            fireHook(to, amount);
        } catch (RuntimeException e) {
            wallets.merge(to, amount.negate(), BigInteger::add);
            throw e;
        }
        log.info("Mock rail: paid {} to {}", amount, to);
    }

    @Override
    public String getAdapterName() {
        return "MockRail";
    }

    public void setTransferHook(BiConsumer<String, BigInteger> transferHook) {
        this.transferHook = transferHook;
    }

    /**
     * Simulate a rail that refuses payouts to one wallet.
     */
    public void setFailingPayee(String failingPayee) {
        this.failingPayee = failingPayee;
    }

    /**
     * Clear all state (for test cleanup).
     */
    public void reset() {
        wallets.clear();
        transferHook = null;
        failingPayee = null;
    }

    private void fireHook(String wallet, BigInteger amount) {
        BiConsumer<String, BigInteger> hook = transferHook;
        if (hook != null) {
            hook.accept(wallet, amount);
        }
    }
}
