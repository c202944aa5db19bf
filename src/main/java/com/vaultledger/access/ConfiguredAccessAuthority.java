package com.vaultledger.access;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Access authority backed by configuration.
 *
 * Owner and operators come from {@code vault-ledger.access.*}; pause flags are
 * held in memory and can be toggled by the owner or an operator.
 */
@Component
@Slf4j
public class ConfiguredAccessAuthority implements AccessAuthority {

    private final String owner;
    private final Set<String> operators;

    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final AtomicBoolean depositsPaused = new AtomicBoolean(false);
    private final AtomicBoolean withdrawalsPaused = new AtomicBoolean(false);

    public ConfiguredAccessAuthority(
            @Value("${vault-ledger.access.owner}") String owner,
            @Value("${vault-ledger.access.operators:}") List<String> operators) {
        this.owner = owner;
        this.operators = Set.copyOf(operators);
        log.info("Access authority initialized: owner={}, operators={}", owner, this.operators);
    }

    @Override
    public String owner() {
        return owner;
    }

    @Override
    public boolean isOperator(String identity) {
        return identity != null && operators.contains(identity);
    }

    @Override
    public boolean paused() {
        return paused.get();
    }

    @Override
    public boolean depositsPaused() {
        return depositsPaused.get();
    }

    @Override
    public boolean withdrawalsPaused() {
        return withdrawalsPaused.get();
    }

    @Override
    public void setPaused(String caller, boolean value) {
        requireOperator(caller, "setPaused");
        paused.set(value);
        log.warn("Ledger {} by {}", value ? "PAUSED" : "UNPAUSED", caller);
    }

    @Override
    public void setDepositsPaused(String caller, boolean value) {
        requireOperator(caller, "setDepositsPaused");
        depositsPaused.set(value);
        log.warn("Deposits {} by {}", value ? "PAUSED" : "UNPAUSED", caller);
    }

    @Override
    public void setWithdrawalsPaused(String caller, boolean value) {
        requireOperator(caller, "setWithdrawalsPaused");
        withdrawalsPaused.set(value);
        log.warn("Withdrawals {} by {}", value ? "PAUSED" : "UNPAUSED", caller);
    }
}
