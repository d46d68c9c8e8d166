package me.internalizable.modmanager.ledger;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;

/**
 * Timestamps kept alongside the ledger entries.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"created_at", "updated_at", "last_update_check"})
public class LedgerMetadata {

    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastUpdateCheck;

    @Nonnull
    public LedgerMetadata copy() {
        LedgerMetadata copy = new LedgerMetadata();
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        copy.lastUpdateCheck = lastUpdateCheck;
        return copy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    /**
     * When the auto-updater last finished a reconciliation pass.
     */
    @Nullable
    public Instant getLastUpdateCheck() {
        return lastUpdateCheck;
    }

    public void setLastUpdateCheck(Instant lastUpdateCheck) {
        this.lastUpdateCheck = lastUpdateCheck;
    }
}
