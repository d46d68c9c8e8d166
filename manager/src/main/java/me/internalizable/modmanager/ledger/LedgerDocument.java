package me.internalizable.modmanager.ledger;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;
import java.util.TreeMap;

/**
 * Persisted form of the ledger.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"schema_version", "mods", "metadata"})
class LedgerDocument {

    private Integer schemaVersion;
    private Map<String, InstalledMod> mods = new TreeMap<>();
    private LedgerMetadata metadata = new LedgerMetadata();

    LedgerDocument copy() {
        LedgerDocument copy = new LedgerDocument();
        copy.schemaVersion = schemaVersion;
        mods.forEach((slug, mod) -> copy.mods.put(slug, mod.copy()));
        copy.metadata = metadata.copy();
        return copy;
    }

    public Integer getSchemaVersion() {
        return schemaVersion;
    }

    public void setSchemaVersion(Integer schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public Map<String, InstalledMod> getMods() {
        return mods;
    }

    public void setMods(Map<String, InstalledMod> mods) {
        this.mods = mods != null ? new TreeMap<>(mods) : new TreeMap<>();
    }

    public LedgerMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(LedgerMetadata metadata) {
        this.metadata = metadata != null ? metadata : new LedgerMetadata();
    }
}
