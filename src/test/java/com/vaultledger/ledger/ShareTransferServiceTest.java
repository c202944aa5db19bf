package com.vaultledger.ledger;

import com.vaultledger.common.exception.InsufficientSharesException;
import com.vaultledger.common.exception.InvalidAmountException;
import com.vaultledger.common.exception.InvalidParameterException;
import com.vaultledger.custody.AssetTransferAdapter;
import com.vaultledger.custody.CustodyVenueAdapter;
import com.vaultledger.custody.mock.MockAssetTransferAdapter;
import com.vaultledger.custody.mock.MockCustodyVenueAdapter;
import com.vaultledger.deposit.DepositService;
import com.vaultledger.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for holder-to-holder share transfers.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ShareTransferServiceTest {

    @Autowired
    private ShareTransferService shareTransferService;

    @Autowired
    private DepositService depositService;

    @Autowired
    private ShareLedger shareLedger;

    @Autowired
    private VaultQueryService vaultQueryService;

    @Autowired
    private CustodyVenueAdapter custodyVenueAdapter;

    @Autowired
    private AssetTransferAdapter assetTransferAdapter;

    @Autowired
    private MutableClock clock;

    private String alice;
    private String bob;

    @BeforeEach
    void setUp() {
        clock.reset();
        alice = "alice-" + UUID.randomUUID();
        bob = "bob-" + UUID.randomUUID();
        ((MockAssetTransferAdapter) assetTransferAdapter).fund(alice, BigInteger.valueOf(1_000));
        depositService.deposit(alice, BigInteger.valueOf(1_000));
    }

    @AfterEach
    void tearDown() {
        ((MockCustodyVenueAdapter) custodyVenueAdapter).reset();
        ((MockAssetTransferAdapter) assetTransferAdapter).reset();
    }

    @Test
    void testTransferMovesShares() {
        shareTransferService.transferShares(alice, bob, BigInteger.valueOf(300));

        assertEquals(BigInteger.valueOf(700), shareLedger.balanceOf(alice));
        assertEquals(BigInteger.valueOf(300), shareLedger.balanceOf(bob));
        assertEquals(BigInteger.valueOf(1_000), vaultQueryService.getSummary().getTotalShareSupply());

        List<LedgerEntry> journal = vaultQueryService.getJournal(alice);
        assertTrue(journal.stream().anyMatch(e ->
            e.getEventType() == LedgerEventType.SHARES_TRANSFERRED && bob.equals(e.getCounterparty())));
    }

    @Test
    void testTransferIntoEscrowAllowed() {
        shareTransferService.transferShares(alice, ShareLedger.ESCROW_HOLDER, BigInteger.TEN);

        assertEquals(BigInteger.TEN, shareLedger.escrowBalance());
        assertEquals(BigInteger.ZERO, vaultQueryService.getSummary().getPendingWithdrawalShares());
    }

    @Test
    void testInvalidTransfersRejected() {
        assertThrows(InvalidAmountException.class,
            () -> shareTransferService.transferShares(alice, bob, BigInteger.ZERO));
        assertThrows(InsufficientSharesException.class,
            () -> shareTransferService.transferShares(alice, bob, BigInteger.valueOf(1_001)));
        assertThrows(InvalidParameterException.class,
            () -> shareTransferService.transferShares(ShareLedger.ESCROW_HOLDER, bob, BigInteger.ONE));
        assertThrows(InvalidParameterException.class,
            () -> shareTransferService.transferShares(alice, " ", BigInteger.ONE));
    }
}
