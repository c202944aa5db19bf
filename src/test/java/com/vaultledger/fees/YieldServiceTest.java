package com.vaultledger.fees;

import com.vaultledger.access.AccessAuthority;
import com.vaultledger.common.FixedPoint;
import com.vaultledger.common.OperationGuard;
import com.vaultledger.common.exception.UnauthorizedCallerException;
import com.vaultledger.common.exception.YieldBoundExceededException;
import com.vaultledger.common.exception.YieldReportTooFrequentException;
import com.vaultledger.custody.AssetTransferAdapter;
import com.vaultledger.custody.CustodyVenueAdapter;
import com.vaultledger.custody.mock.MockAssetTransferAdapter;
import com.vaultledger.custody.mock.MockCustodyVenueAdapter;
import com.vaultledger.deposit.DepositService;
import com.vaultledger.ledger.LedgerEventType;
import com.vaultledger.ledger.LedgerInvariants;
import com.vaultledger.ledger.LedgerService;
import com.vaultledger.ledger.ShareLedger;
import com.vaultledger.ledger.VaultQueryService;
import com.vaultledger.ledger.VaultStateService;
import com.vaultledger.pricing.PricingEngine;
import com.vaultledger.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for yield reporting and high-water-mark fees.
 *
 * Each test starts with 1,000,000 shares outstanding at price 1.0, a 20% fee
 * rate and a 10% bound on a single report.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class YieldServiceTest {

    private static final BigInteger MILLION = BigInteger.valueOf(1_000_000);

    @Autowired
    private YieldService yieldService;

    @Autowired
    private DepositService depositService;

    @Autowired
    private VaultQueryService vaultQueryService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private ShareLedger shareLedger;

    @Autowired
    private OperationGuard operationGuard;

    @Autowired
    private VaultStateService vaultStateService;

    @Autowired
    private PricingEngine pricingEngine;

    @Autowired
    private LedgerInvariants ledgerInvariants;

    @Autowired
    private AccessAuthority accessAuthority;

    @Autowired
    private CustodyVenueAdapter custodyVenueAdapter;

    @Autowired
    private AssetTransferAdapter assetTransferAdapter;

    @Autowired
    private MutableClock clock;

    private MockAssetTransferAdapter rail;

    @BeforeEach
    void setUp() {
        clock.reset();
        rail = (MockAssetTransferAdapter) assetTransferAdapter;
        String alice = "alice-" + UUID.randomUUID();
        rail.fund(alice, MILLION);
        depositService.deposit(alice, MILLION);
    }

    @AfterEach
    void tearDown() {
        ((MockCustodyVenueAdapter) custodyVenueAdapter).reset();
        rail.reset();
    }

    @Test
    void testFeeTakenOnProfitAboveHighWaterMark() {
        YieldReport report = yieldService.reportYieldAndCollectFees("owner", BigInteger.valueOf(100_000));

        // 20% of 100,000 profit
        assertEquals(BigInteger.valueOf(20_000), report.getFeeValue());
        // 20,000 * 1,000,000 / (1,100,000 - 20,000)
        assertEquals(BigInteger.valueOf(18_518), report.getFeeShares());
        assertTrue(report.isFeeCollected());
        assertEquals(BigInteger.valueOf(18_518), shareLedger.balanceOf("treasury"));
        assertEquals(BigInteger.valueOf(1_100_000), report.getNavAfter());

        BigInteger treasuryValue = vaultQueryService.convertToValue(BigInteger.valueOf(18_518));
        assertTrue(treasuryValue.compareTo(BigInteger.valueOf(19_999)) >= 0);
        assertTrue(treasuryValue.compareTo(BigInteger.valueOf(20_000)) <= 0);

        assertEquals(report.getSharePrice(), report.getPriceHighWaterMark());
        assertEquals(report.getSharePrice(), vaultQueryService.getSummary().getPriceHighWaterMark());
        assertEquals(1, ledgerService.getEntries(LedgerEventType.FEE_COLLECTED).size());
    }

    @Test
    void testLossTakesNoFeeAndKeepsHighWaterMark() {
        YieldReport loss = yieldService.reportYieldAndCollectFees("owner", BigInteger.valueOf(-50_000));

        assertFalse(loss.isFeeCollected());
        assertEquals(FixedPoint.PRECISION, loss.getPriceHighWaterMark());
        assertTrue(loss.getSharePrice().compareTo(FixedPoint.PRECISION) < 0);

        // recovery back to the old mark earns nothing
        YieldReport recovery = yieldService.reportYieldAndCollectFees("owner", BigInteger.valueOf(50_000));
        assertFalse(recovery.isFeeCollected());
        assertEquals(FixedPoint.PRECISION, recovery.getSharePrice());

        YieldReport gain = yieldService.reportYieldAndCollectFees("owner", BigInteger.valueOf(10_000));
        assertEquals(BigInteger.valueOf(2_000), gain.getFeeValue());
    }

    @Test
    void testFeeOnlyOnGainAboveMarkWhenRecoveringPastIt() {
        yieldService.reportYieldAndCollectFees("owner", BigInteger.valueOf(-50_000));

        YieldReport report = yieldService.reportYieldAndCollectFees("owner", BigInteger.valueOf(60_000));

        // only the 10,000 above the previous mark is profit
        assertEquals(BigInteger.valueOf(2_000), report.getFeeValue());
    }

    @Test
    void testYieldBoundEnforcedBothWays() {
        assertThrows(YieldBoundExceededException.class,
            () -> yieldService.reportYieldAndCollectFees("owner", BigInteger.valueOf(100_001)));
        assertThrows(YieldBoundExceededException.class,
            () -> yieldService.reportYieldAndCollectFees("owner", BigInteger.valueOf(-100_001)));

        assertEquals(BigInteger.valueOf(100_000),
            yieldService.reportYieldAndCollectFees("owner", BigInteger.valueOf(100_000)).getYieldDelta());
    }

    @Test
    void testRepeatedReportsCompoundBeyondSingleCallBound() {
        BigInteger bound = FixedPoint.fraction("0.1");
        for (int i = 0; i < 10; i++) {
            BigInteger nav = vaultQueryService.getSummary().getTotalAssets();
            yieldService.reportYieldAndCollectFees("owner", FixedPoint.applyRate(nav, bound));
        }

        // each call stays within 10% of NAV, yet NAV grows by roughly 1.1^10
        BigInteger nav = vaultQueryService.getSummary().getTotalAssets();
        assertTrue(nav.compareTo(BigInteger.valueOf(2_500_000)) > 0);
    }

    @Test
    void testMinimumReportIntervalStopsCompounding() {
        YieldService throttled = new YieldService(operationGuard, vaultStateService, pricingEngine, shareLedger,
            ledgerService, ledgerInvariants, accessAuthority, clock, Duration.ofHours(1));

        throttled.reportYieldAndCollectFees("owner", BigInteger.valueOf(1_000));
        assertThrows(YieldReportTooFrequentException.class,
            () -> throttled.reportYieldAndCollectFees("owner", BigInteger.valueOf(1_000)));

        clock.advance(Duration.ofHours(1));
        assertDoesNotThrow(() -> throttled.reportYieldAndCollectFees("owner", BigInteger.valueOf(1_000)));
    }

    @Test
    void testResetHighWaterMarkAfterLoss() {
        yieldService.reportYieldAndCollectFees("owner", BigInteger.valueOf(-50_000));

        BigInteger mark = yieldService.resetPriceHWM("owner");

        assertEquals(new BigInteger("950000000000000000"), mark);
        assertEquals(mark, vaultQueryService.getSummary().getPriceHighWaterMark());
        assertEquals(1, ledgerService.getEntries(LedgerEventType.HWM_RESET).size());

        // gains above the lowered mark are charged again
        YieldReport report = yieldService.reportYieldAndCollectFees("owner", BigInteger.valueOf(10_000));
        assertEquals(BigInteger.valueOf(2_000), report.getFeeValue());
    }

    @Test
    void testOnlyOwnerReportsYield() {
        assertThrows(UnauthorizedCallerException.class,
            () -> yieldService.reportYieldAndCollectFees("operator", BigInteger.valueOf(1_000)));
        assertThrows(UnauthorizedCallerException.class,
            () -> yieldService.resetPriceHWM("operator"));
    }
}
