package com.vaultledger.ledger;

import com.vaultledger.common.exception.InvariantViolationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Access to the singleton {@link VaultState} row.
 */
@Service
@RequiredArgsConstructor
public class VaultStateService {

    private final VaultStateRepository vaultStateRepository;

    public VaultState load() {
        return vaultStateRepository.findById(VaultState.PRIMARY_ID)
            .orElseThrow(() -> new InvariantViolationException("VAULT_INITIALIZED",
                "vault state has not been initialized"));
    }

    public boolean isInitialized() {
        return vaultStateRepository.existsById(VaultState.PRIMARY_ID);
    }

    public VaultState save(VaultState state) {
        return vaultStateRepository.save(state);
    }
}
