package com.vaultledger.custody.mock;

import com.vaultledger.custody.CustodyException;
import com.vaultledger.custody.CustodyVenueAdapter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mock custody venue for testing and development.
 *
 * Keeps venue balances in memory. Recalls can be capped or switched off to
 * simulate capital that is deployed and not immediately returnable.
 *
 * NOT FOR PRODUCTION: a real venue integration replaces this adapter.
 */
@Slf4j
public class MockCustodyVenueAdapter implements CustodyVenueAdapter {

    // venueRef -> balance
    private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();

    private volatile boolean recallEnabled = true;
    private volatile boolean available = true;

    @Override
    public void forward(String venueRef, BigInteger amount) {
        requireAvailable(venueRef, "forward");
        balances.merge(venueRef, amount, BigInteger::add);
        log.info("Mock venue {}: received {}", venueRef, amount);
    }

    @Override
    public BigInteger recall(String venueRef, BigInteger amount) {
        requireAvailable(venueRef, "recall");
        if (!recallEnabled) {
            log.info("Mock venue {}: recall of {} refused, capital deployed", venueRef, amount);
            return BigInteger.ZERO;
        }
        BigInteger balance = getBalance(venueRef);
        BigInteger returned = balance.min(amount);
        balances.put(venueRef, balance.subtract(returned));
        log.info("Mock venue {}: returned {} of {} requested", venueRef, returned, amount);
        return returned;
    }

    @Override
    public BigInteger getBalance(String venueRef) {
        return balances.getOrDefault(venueRef, BigInteger.ZERO);
    }

    @Override
    public String getAdapterName() {
        return "MockVenue";
    }

    /**
     * Simulate capital that cannot be returned on demand.
     */
    public void setRecallEnabled(boolean recallEnabled) {
        this.recallEnabled = recallEnabled;
    }

    /**
     * Simulate an unreachable venue.
     */
    public void setAvailable(boolean available) {
        this.available = available;
    }

    /**
     * Clear all state (for test cleanup).
     */
    public void reset() {
        balances.clear();
        recallEnabled = true;
        available = true;
    }

    private void requireAvailable(String venueRef, String operation) {
        if (!available) {
            throw new CustodyException("Mock venue unavailable", venueRef, operation);
        }
    }
}
