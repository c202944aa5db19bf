package com.vaultledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Vault Ledger.
 *
 * Vault Ledger is the accounting core of a pooled savings product: depositors
 * contribute currency and receive shares whose value tracks a reported NAV.
 * Withdrawals go through an escrowed FIFO queue and fees are minted as shares
 * only on profit above the price high-water-mark.
 */
@SpringBootApplication
public class VaultLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(VaultLedgerApplication.class, args);
    }
}
