package com.vaultledger.governance;

import com.vaultledger.common.exception.TimelockException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A timelocked parameter change waiting for its delay to pass.
 */
@Entity
@Table(name = "pending_parameter_changes", indexes = {
    @Index(name = "idx_change_parameter_status", columnList = "parameter, status")
})
@Data
@NoArgsConstructor
public class PendingParameterChange {

    @Id
    private String changeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TimelockedParameter parameter;

    /**
     * Proposed value in its textual form; parsed again at execution.
     */
    @Column(nullable = false)
    private String newValue;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ChangeStatus status;

    private String queuedBy;

    @Column(nullable = false, updatable = false)
    private Instant queuedAt;

    @Column(nullable = false)
    private Instant executableAt;

    private Instant resolvedAt;

    public PendingParameterChange(TimelockedParameter parameter, String newValue, String queuedBy,
                                  Instant queuedAt, Instant executableAt) {
        this.changeId = UUID.randomUUID().toString();
        this.parameter = parameter;
        this.newValue = newValue;
        this.queuedBy = queuedBy;
        this.queuedAt = queuedAt;
        this.executableAt = executableAt;
        this.status = ChangeStatus.QUEUED;
    }

    public boolean isReady(Instant now) {
        return !now.isBefore(executableAt);
    }

    public void markExecuted(Instant now) {
        requireQueued("execute");
        if (!isReady(now)) {
            throw new TimelockException(String.format(
                "Change %s for %s not executable until %s", changeId, parameter, executableAt));
        }
        this.status = ChangeStatus.EXECUTED;
        this.resolvedAt = now;
    }

    public void markCancelled(Instant now) {
        requireQueued("cancel");
        this.status = ChangeStatus.CANCELLED;
        this.resolvedAt = now;
    }

    private void requireQueued(String action) {
        if (status != ChangeStatus.QUEUED) {
            throw new TimelockException(String.format(
                "Cannot %s change %s in status %s", action, changeId, status));
        }
    }
}
