package com.vaultledger.deposit;

import com.vaultledger.access.AccessAuthority;
import com.vaultledger.common.FixedPoint;
import com.vaultledger.common.exception.CapExceededException;
import com.vaultledger.common.exception.InsufficientFundsException;
import com.vaultledger.common.exception.InvalidAmountException;
import com.vaultledger.common.exception.InvalidParameterException;
import com.vaultledger.common.exception.OperationPausedException;
import com.vaultledger.common.exception.ZeroSharesException;
import com.vaultledger.custody.AssetTransferAdapter;
import com.vaultledger.custody.CustodyVenueAdapter;
import com.vaultledger.custody.mock.MockAssetTransferAdapter;
import com.vaultledger.custody.mock.MockCustodyVenueAdapter;
import com.vaultledger.fees.YieldService;
import com.vaultledger.governance.ParameterService;
import com.vaultledger.ledger.LedgerEntry;
import com.vaultledger.ledger.LedgerEventType;
import com.vaultledger.ledger.ShareLedger;
import com.vaultledger.ledger.VaultQueryService;
import com.vaultledger.ledger.VaultSummary;
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
 * Integration tests for the deposit flow.
 *
 * The test profile keeps a liquidity buffer of 100,000; everything above it is
 * forwarded to the mock custody venue.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class DepositServiceTest {

    private static final BigInteger MILLION = BigInteger.valueOf(1_000_000);

    @Autowired
    private DepositService depositService;

    @Autowired
    private VaultQueryService vaultQueryService;

    @Autowired
    private ShareLedger shareLedger;

    @Autowired
    private YieldService yieldService;

    @Autowired
    private ParameterService parameterService;

    @Autowired
    private AccessAuthority accessAuthority;

    @Autowired
    private CustodyVenueAdapter custodyVenueAdapter;

    @Autowired
    private AssetTransferAdapter assetTransferAdapter;

    @Autowired
    private MutableClock clock;

    private MockCustodyVenueAdapter venue;
    private MockAssetTransferAdapter rail;
    private String alice;
    private String bob;

    @BeforeEach
    void setUp() {
        clock.reset();
        venue = (MockCustodyVenueAdapter) custodyVenueAdapter;
        rail = (MockAssetTransferAdapter) assetTransferAdapter;
        alice = "alice-" + UUID.randomUUID();
        bob = "bob-" + UUID.randomUUID();
    }

    @AfterEach
    void tearDown() {
        venue.reset();
        rail.reset();
        accessAuthority.setPaused("owner", false);
        accessAuthority.setDepositsPaused("owner", false);
        accessAuthority.setWithdrawalsPaused("owner", false);
    }

    @Test
    void testFirstDepositMintsAtInitialPrice() {
        rail.fund(alice, MILLION);

        DepositReceipt receipt = depositService.deposit(alice, MILLION);

        assertEquals(MILLION, receipt.getShares());
        assertEquals(FixedPoint.INITIAL_SHARE_PRICE, receipt.getSharePrice());
        assertEquals(MILLION, shareLedger.balanceOf(alice));
        assertEquals(BigInteger.ZERO, rail.balanceOf(alice));

        VaultSummary summary = vaultQueryService.getSummary();
        assertEquals(MILLION, summary.getTotalAssets());
        assertEquals(MILLION, summary.getTotalShareSupply());
        assertEquals(MILLION, vaultQueryService.getAccount(alice).getTotalDeposited());

        List<LedgerEntry> journal = vaultQueryService.getJournal(alice);
        assertEquals(1, journal.size());
        assertEquals(LedgerEventType.DEPOSIT, journal.get(0).getEventType());
    }

    @Test
    void testExcessAboveBufferForwardedToVenue() {
        rail.fund(alice, MILLION);

        DepositReceipt receipt = depositService.deposit(alice, MILLION);

        assertEquals(BigInteger.valueOf(900_000), receipt.getForwardedToVenue());
        assertEquals(BigInteger.valueOf(900_000), venue.getBalance("custody-venue"));
        assertEquals(BigInteger.valueOf(100_000), vaultQueryService.getSummary().getLiquidBalance());
    }

    @Test
    void testDepositBelowBufferStaysLiquid() {
        rail.fund(alice, BigInteger.valueOf(50_000));

        DepositReceipt receipt = depositService.deposit(alice, BigInteger.valueOf(50_000));

        assertEquals(BigInteger.ZERO, receipt.getForwardedToVenue());
        assertEquals(BigInteger.ZERO, venue.getBalance("custody-venue"));
    }

    @Test
    void testLaterDepositPricedAtCurrentNav() {
        rail.fund(alice, MILLION);
        depositService.deposit(alice, MILLION);
        yieldService.reportYieldAndCollectFees("owner", BigInteger.valueOf(100_000));

        rail.fund(bob, MILLION);
        DepositReceipt receipt = depositService.deposit(bob, MILLION);

        assertTrue(receipt.getSharePrice().compareTo(FixedPoint.INITIAL_SHARE_PRICE) > 0);
        assertTrue(receipt.getShares().compareTo(MILLION) < 0);
        // rounding never hands the depositor more than they paid
        assertTrue(vaultQueryService.convertToValue(receipt.getShares()).compareTo(MILLION) <= 0);
    }

    @Test
    void testZeroAmountRejected() {
        assertThrows(InvalidAmountException.class, () -> depositService.deposit(alice, BigInteger.ZERO));
        assertThrows(InvalidAmountException.class, () -> depositService.deposit(alice, BigInteger.valueOf(-1)));
    }

    @Test
    void testDepositWorthLessThanOneShareRejected() {
        rail.fund(alice, MILLION);
        depositService.deposit(alice, MILLION);
        yieldService.reportYieldAndCollectFees("owner", BigInteger.valueOf(100_000));

        rail.fund(bob, BigInteger.ONE);
        assertThrows(ZeroSharesException.class, () -> depositService.deposit(bob, BigInteger.ONE));
    }

    @Test
    void testPerUserCapEnforced() {
        parameterService.setPerUserCap("owner", BigInteger.valueOf(1_500_000));
        rail.fund(alice, BigInteger.valueOf(2_000_000));
        depositService.deposit(alice, MILLION);

        CapExceededException e = assertThrows(CapExceededException.class,
            () -> depositService.deposit(alice, BigInteger.valueOf(600_000)));
        assertEquals("Per-user cap", e.getCapName());

        DepositReceipt receipt = depositService.deposit(alice, BigInteger.valueOf(500_000));
        assertEquals(BigInteger.valueOf(500_000), receipt.getShares());
    }

    @Test
    void testGlobalCapEnforced() {
        parameterService.setGlobalCap("owner", BigInteger.valueOf(1_200_000));
        rail.fund(alice, MILLION);
        rail.fund(bob, MILLION);
        depositService.deposit(alice, MILLION);

        CapExceededException e = assertThrows(CapExceededException.class,
            () -> depositService.deposit(bob, BigInteger.valueOf(300_000)));
        assertEquals("Global cap", e.getCapName());
    }

    @Test
    void testDepositsPaused() {
        rail.fund(alice, MILLION);
        accessAuthority.setDepositsPaused("operator", true);

        assertThrows(OperationPausedException.class, () -> depositService.deposit(alice, MILLION));

        accessAuthority.setDepositsPaused("operator", false);
        assertEquals(MILLION, depositService.deposit(alice, MILLION).getShares());
    }

    @Test
    void testLedgerPauseBlocksDeposits() {
        rail.fund(alice, MILLION);
        accessAuthority.setPaused("owner", true);

        assertThrows(OperationPausedException.class, () -> depositService.deposit(alice, MILLION));
    }

    @Test
    void testEscrowIdentityCannotDeposit() {
        assertThrows(InvalidParameterException.class,
            () -> depositService.deposit(ShareLedger.ESCROW_HOLDER, MILLION));
    }

    @Test
    void testUnfundedDepositorRejected() {
        assertThrows(InsufficientFundsException.class, () -> depositService.deposit(alice, MILLION));
    }
}
