package com.vaultledger.ledger;

import com.vaultledger.common.exception.InsufficientSharesException;
import com.vaultledger.common.exception.InvalidAmountException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;

/**
 * The only component allowed to change share balances.
 *
 * Mint and burn keep {@link VaultState#getTotalShareSupply()} in step with the
 * account rows. Callers must already be inside a ledger operation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ShareLedger {

    /**
     * Holder id of the ledger's own escrow account.
     */
    public static final String ESCROW_HOLDER = "vault-ledger:escrow";

    private final ShareAccountRepository shareAccountRepository;
    private final Clock clock;

    public BigInteger balanceOf(String holderId) {
        return shareAccountRepository.findById(holderId)
            .map(ShareAccount::getShares)
            .orElse(BigInteger.ZERO);
    }

    public BigInteger escrowBalance() {
        return balanceOf(ESCROW_HOLDER);
    }

    public ShareAccount getOrCreate(String holderId) {
        return shareAccountRepository.findById(holderId)
            .orElseGet(() -> shareAccountRepository.save(new ShareAccount(holderId, clock.instant())));
    }

    public void mint(VaultState state, String holderId, BigInteger shares) {
        requirePositive(shares);
        ShareAccount account = getOrCreate(holderId);
        account.credit(shares, clock.instant());
        shareAccountRepository.save(account);
        state.setTotalShareSupply(state.getTotalShareSupply().add(shares));
        log.debug("Minted {} shares to {}", shares, holderId);
    }

    public void burn(VaultState state, String holderId, BigInteger shares) {
        requirePositive(shares);
        ShareAccount account = getOrCreate(holderId);
        if (account.getShares().compareTo(shares) < 0) {
            throw new InsufficientSharesException(holderId, shares, account.getShares());
        }
        account.debit(shares, clock.instant());
        shareAccountRepository.save(account);
        state.setTotalShareSupply(state.getTotalShareSupply().subtract(shares));
        log.debug("Burned {} shares from {}", shares, holderId);
    }

    public void transfer(String from, String to, BigInteger shares) {
        requirePositive(shares);
        ShareAccount source = getOrCreate(from);
        if (source.getShares().compareTo(shares) < 0) {
            throw new InsufficientSharesException(from, shares, source.getShares());
        }
        ShareAccount target = getOrCreate(to);
        source.debit(shares, clock.instant());
        target.credit(shares, clock.instant());
        shareAccountRepository.save(source);
        shareAccountRepository.save(target);
        log.debug("Transferred {} shares from {} to {}", shares, from, to);
    }

    public void recordDeposit(String holderId, BigInteger value) {
        ShareAccount account = getOrCreate(holderId);
        account.recordDeposit(value, clock.instant());
        shareAccountRepository.save(account);
    }

    public BigInteger sumOfBalances() {
        BigInteger sum = shareAccountRepository.sumAllShares();
        return sum == null ? BigInteger.ZERO : sum;
    }

    private void requirePositive(BigInteger shares) {
        if (shares == null || shares.signum() <= 0) {
            throw new InvalidAmountException("shares", shares);
        }
    }
}
