package com.vaultledger.custody;

import java.math.BigInteger;

/**
 * Interface to the external venue where capital above the liquidity buffer is deployed.
 *
 * The venue is where yield is earned; the ledger never looks inside it. The
 * ledger only forwards excess value and asks for value back when the buffer
 * cannot cover a payout.
 */
public interface CustodyVenueAdapter {

    /**
     * Send value to the venue.
     *
     * @param venueRef venue reference configured on the vault
     * @param amount amount to forward
     * @throws CustodyException if the venue rejects the transfer
     */
    void forward(String venueRef, BigInteger amount);

    /**
     * Ask the venue to return value to the ledger.
     *
     * The venue may return less than requested (capital is deployed). Returning
     * less is not an error; the ledger degrades gracefully.
     *
     * @param venueRef venue reference configured on the vault
     * @param amount amount requested
     * @return amount actually returned, between zero and {@code amount}
     * @throws CustodyException if the venue cannot be reached
     */
    BigInteger recall(String venueRef, BigInteger amount);

    /**
     * Value currently held at the venue, as far as the venue reports it.
     */
    BigInteger getBalance(String venueRef);

    /**
     * Name of this adapter, used for logging.
     */
    String getAdapterName();
}
