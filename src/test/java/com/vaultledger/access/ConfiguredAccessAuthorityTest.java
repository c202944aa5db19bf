package com.vaultledger.access;

import com.vaultledger.common.exception.OperationPausedException;
import com.vaultledger.common.exception.UnauthorizedCallerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the configuration-backed access authority.
 */
class ConfiguredAccessAuthorityTest {

    private ConfiguredAccessAuthority authority;

    @BeforeEach
    void setUp() {
        authority = new ConfiguredAccessAuthority("owner", List.of("operator-1", "operator-2"));
    }

    @Test
    void testOwnerHoldsOperatorCapability() {
        assertTrue(authority.isOwner("owner"));
        assertFalse(authority.isOperator("owner"));
        assertDoesNotThrow(() -> authority.requireOperator("owner", "fulfillWithdrawals"));
        assertDoesNotThrow(() -> authority.requireOperator("operator-2", "fulfillWithdrawals"));
    }

    @Test
    void testOperatorIsNotOwner() {
        assertThrows(UnauthorizedCallerException.class, () -> authority.requireOwner("operator-1", "resetPriceHWM"));
        assertThrows(UnauthorizedCallerException.class, () -> authority.requireOwner(null, "resetPriceHWM"));
        assertThrows(UnauthorizedCallerException.class, () -> authority.requireOperator("holder", "fulfill"));
    }

    @Test
    void testPauseFlags() {
        authority.setDepositsPaused("operator-1", true);
        assertThrows(OperationPausedException.class, () -> authority.requireDepositsOpen());
        assertDoesNotThrow(() -> authority.requireWithdrawalsOpen("requestWithdrawal"));

        authority.setDepositsPaused("operator-1", false);
        authority.setPaused("owner", true);
        assertThrows(OperationPausedException.class, () -> authority.requireDepositsOpen());
        assertThrows(OperationPausedException.class, () -> authority.requireWithdrawalsOpen("requestWithdrawal"));

        authority.setPaused("owner", false);
        authority.setWithdrawalsPaused("operator-2", true);
        assertTrue(authority.withdrawalsPaused());
        assertDoesNotThrow(() -> authority.requireDepositsOpen());
    }

    @Test
    void testHoldersCannotPause() {
        assertThrows(UnauthorizedCallerException.class, () -> authority.setPaused("holder", true));
        assertFalse(authority.paused());
    }
}
