package com.vaultledger.config;

import com.vaultledger.custody.AssetTransferAdapter;
import com.vaultledger.custody.CustodyVenueAdapter;
import com.vaultledger.custody.mock.MockAssetTransferAdapter;
import com.vaultledger.custody.mock.MockCustodyVenueAdapter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring for the ledger's external collaborators.
 *
 * The custody venue and currency rail default to in-memory mocks; a deployment
 * replaces these beans with real integrations.
 */
@Configuration
public class LedgerConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CustodyVenueAdapter custodyVenueAdapter() {
        return new MockCustodyVenueAdapter();
    }

    @Bean
    public AssetTransferAdapter assetTransferAdapter() {
        return new MockAssetTransferAdapter();
    }
}
