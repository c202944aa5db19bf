package com.vaultledger.governance;

import com.vaultledger.access.AccessAuthority;
import com.vaultledger.common.OperationGuard;
import com.vaultledger.common.exception.InvalidParameterException;
import com.vaultledger.common.exception.TimelockException;
import com.vaultledger.ledger.LedgerInvariants;
import com.vaultledger.ledger.LedgerService;
import com.vaultledger.ledger.ShareLedger;
import com.vaultledger.ledger.VaultState;
import com.vaultledger.ledger.VaultStateService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Delayed changes to sensitive vault parameters.
 *
 * A change is validated when queued and again when executed. Only one change
 * per parameter may be queued at a time.
 */
@Service
@Slf4j
public class TimelockService {

    public static final Duration MAX_COOLDOWN = Duration.ofDays(30);

    private final OperationGuard operationGuard;
    private final VaultStateService vaultStateService;
    private final PendingParameterChangeRepository changeRepository;
    private final LedgerService ledgerService;
    private final LedgerInvariants ledgerInvariants;
    private final AccessAuthority accessAuthority;
    private final Clock clock;
    private final Map<TimelockedParameter, Duration> delays = new EnumMap<>(TimelockedParameter.class);

    public TimelockService(OperationGuard operationGuard,
                           VaultStateService vaultStateService,
                           PendingParameterChangeRepository changeRepository,
                           LedgerService ledgerService,
                           LedgerInvariants ledgerInvariants,
                           AccessAuthority accessAuthority,
                           Clock clock,
                           @Value("${vault-ledger.timelock.fee-rate-delay:P2D}") Duration feeRateDelay,
                           @Value("${vault-ledger.timelock.cooldown-period-delay:P1D}") Duration cooldownDelay,
                           @Value("${vault-ledger.timelock.treasury-delay:P2D}") Duration treasuryDelay,
                           @Value("${vault-ledger.timelock.custody-venue-delay:P3D}") Duration custodyVenueDelay) {
        this.operationGuard = operationGuard;
        this.vaultStateService = vaultStateService;
        this.changeRepository = changeRepository;
        this.ledgerService = ledgerService;
        this.ledgerInvariants = ledgerInvariants;
        this.accessAuthority = accessAuthority;
        this.clock = clock;
        delays.put(TimelockedParameter.FEE_RATE, feeRateDelay);
        delays.put(TimelockedParameter.COOLDOWN_PERIOD, cooldownDelay);
        delays.put(TimelockedParameter.TREASURY, treasuryDelay);
        delays.put(TimelockedParameter.CUSTODY_VENUE, custodyVenueDelay);
    }

    public PendingParameterChange queue(String caller, TimelockedParameter parameter, String newValue) {
        return operationGuard.run("queueParameterChange", () -> {
            accessAuthority.requireOwner(caller, "queueParameterChange");
            if (parameter == null) {
                throw new InvalidParameterException("parameter", "required");
            }
            validate(parameter, newValue);
            if (changeRepository.existsByParameterAndStatus(parameter, ChangeStatus.QUEUED)) {
                throw new TimelockException("A change for " + parameter + " is already queued");
            }

            Instant now = clock.instant();
            Instant executableAt = now.plus(getDelay(parameter));
            PendingParameterChange change = changeRepository.save(
                new PendingParameterChange(parameter, newValue.trim(), caller, now, executableAt));

            log.info("Queued {} change to {} by {}, executable at {}", parameter, newValue, caller, executableAt);
            return change;
        });
    }

    public PendingParameterChange execute(String caller, String changeId) {
        return operationGuard.run("executeParameterChange", () -> {
            accessAuthority.requireOwner(caller, "executeParameterChange");
            PendingParameterChange change = findChange(changeId);

            Instant now = clock.instant();
            validate(change.getParameter(), change.getNewValue());
            change.markExecuted(now);

            VaultState state = vaultStateService.load();
            Object previous = apply(state, change.getParameter(), change.getNewValue());
            state.touch(now);
            changeRepository.save(change);
            ledgerService.recordParameterChange(caller, change.getParameter().name(), previous, change.getNewValue());

            vaultStateService.save(state);
            ledgerInvariants.verify(state);
            return change;
        });
    }

    public PendingParameterChange cancel(String caller, String changeId) {
        return operationGuard.run("cancelParameterChange", () -> {
            accessAuthority.requireOwner(caller, "cancelParameterChange");
            PendingParameterChange change = findChange(changeId);
            change.markCancelled(clock.instant());
            changeRepository.save(change);
            log.info("Cancelled {} change {} by {}", change.getParameter(), changeId, caller);
            return change;
        });
    }

    @Transactional(readOnly = true)
    public List<PendingParameterChange> list() {
        return changeRepository.findAllByOrderByQueuedAtDesc();
    }

    @Transactional(readOnly = true)
    public List<PendingParameterChange> listQueued() {
        return changeRepository.findByStatusOrderByQueuedAtAsc(ChangeStatus.QUEUED);
    }

    public Duration getDelay(TimelockedParameter parameter) {
        return delays.get(parameter);
    }

    private PendingParameterChange findChange(String changeId) {
        return changeRepository.findById(changeId)
            .orElseThrow(() -> new TimelockException("Unknown parameter change " + changeId));
    }

    private void validate(TimelockedParameter parameter, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidParameterException(parameter.name(), "value required");
        }
        switch (parameter) {
            case FEE_RATE -> {
                BigInteger rate = parseInteger(parameter, value);
                if (rate.signum() < 0 || rate.compareTo(LedgerInvariants.MAX_FEE_RATE) > 0) {
                    throw new InvalidParameterException(parameter.name(),
                        "must be between 0 and " + LedgerInvariants.MAX_FEE_RATE);
                }
            }
            case COOLDOWN_PERIOD -> {
                Duration cooldown = parseDuration(parameter, value);
                if (cooldown.isNegative() || cooldown.compareTo(MAX_COOLDOWN) > 0) {
                    throw new InvalidParameterException(parameter.name(), "must be between 0 and " + MAX_COOLDOWN);
                }
            }
            case TREASURY, CUSTODY_VENUE -> {
                if (ShareLedger.ESCROW_HOLDER.equals(value.trim())) {
                    throw new InvalidParameterException(parameter.name(), "cannot be the escrow holder");
                }
            }
        }
    }

    private Object apply(VaultState state, TimelockedParameter parameter, String value) {
        Object previous = switch (parameter) {
            case FEE_RATE -> state.getFeeRate();
            case COOLDOWN_PERIOD -> Duration.ofSeconds(state.getCooldownPeriodSeconds());
            case TREASURY -> state.getTreasuryRef();
            case CUSTODY_VENUE -> state.getCustodyVenueRef();
        };
        switch (parameter) {
            case FEE_RATE -> state.setFeeRate(parseInteger(parameter, value));
            case COOLDOWN_PERIOD -> state.setCooldownPeriodSeconds(parseDuration(parameter, value).getSeconds());
            case TREASURY -> state.setTreasuryRef(value);
            case CUSTODY_VENUE -> state.setCustodyVenueRef(value);
        }
        return previous;
    }

    private BigInteger parseInteger(TimelockedParameter parameter, String value) {
        try {
            return new BigInteger(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(parameter.name(), "not an integer: " + value);
        }
    }

    private Duration parseDuration(TimelockedParameter parameter, String value) {
        try {
            return Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidParameterException(parameter.name(), "not an ISO-8601 duration: " + value);
        }
    }
}
