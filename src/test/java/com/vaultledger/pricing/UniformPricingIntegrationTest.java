package com.vaultledger.pricing;

import com.vaultledger.custody.AssetTransferAdapter;
import com.vaultledger.custody.CustodyVenueAdapter;
import com.vaultledger.custody.mock.MockAssetTransferAdapter;
import com.vaultledger.custody.mock.MockCustodyVenueAdapter;
import com.vaultledger.deposit.DepositService;
import com.vaultledger.fees.YieldReport;
import com.vaultledger.fees.YieldService;
import com.vaultledger.ledger.AccountView;
import com.vaultledger.ledger.ShareLedger;
import com.vaultledger.ledger.VaultQueryService;
import com.vaultledger.support.MutableClock;
import com.vaultledger.withdrawal.WithdrawalQueueService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Every share is worth the same, whoever holds it: a depositor, the escrow or
 * the treasury.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class UniformPricingIntegrationTest {

    @Autowired
    private DepositService depositService;

    @Autowired
    private WithdrawalQueueService withdrawalQueueService;

    @Autowired
    private YieldService yieldService;

    @Autowired
    private VaultQueryService vaultQueryService;

    @Autowired
    private ShareLedger shareLedger;

    @Autowired
    private CustodyVenueAdapter custodyVenueAdapter;

    @Autowired
    private AssetTransferAdapter assetTransferAdapter;

    @Autowired
    private MutableClock clock;

    private MockAssetTransferAdapter rail;
    private String alice;

    @BeforeEach
    void setUp() {
        clock.reset();
        rail = (MockAssetTransferAdapter) assetTransferAdapter;
        alice = "alice-" + UUID.randomUUID();

        rail.fund(alice, BigInteger.valueOf(1_000_000));
        depositService.deposit(alice, BigInteger.valueOf(1_000_000));
        withdrawalQueueService.requestWithdrawal(alice, BigInteger.valueOf(300_000));
    }

    @AfterEach
    void tearDown() {
        ((MockCustodyVenueAdapter) custodyVenueAdapter).reset();
        rail.reset();
    }

    @Test
    void testSharesPricedAlikeAcrossHoldersAfterFeeMint() {
        YieldReport report = yieldService.reportYieldAndCollectFees("owner", BigInteger.valueOf(100_000));
        assertTrue(report.isFeeCollected());
        assertNotEquals(BigInteger.TEN.pow(18), report.getSharePrice());

        for (String holder : new String[] {alice, ShareLedger.ESCROW_HOLDER, "treasury"}) {
            AccountView account = vaultQueryService.getAccount(holder);
            BigInteger shares = account.getShares();
            assertTrue(shares.signum() > 0, holder + " holds no shares");

            assertEquals(vaultQueryService.convertToValue(shares), account.getValue());

            BigInteger back = vaultQueryService.convertToShares(account.getValue());
            BigInteger lost = shares.subtract(back);
            assertTrue(lost.signum() >= 0 && lost.compareTo(BigInteger.ONE) <= 0,
                holder + " lost " + lost + " shares in a round trip");
        }

        assertEquals(BigInteger.valueOf(700_000), shareLedger.balanceOf(alice));
        assertEquals(BigInteger.valueOf(300_000), shareLedger.escrowBalance());
        assertEquals(report.getFeeShares(), shareLedger.balanceOf("treasury"));
    }
}
