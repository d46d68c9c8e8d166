package me.internalizable.modmanager.ledger;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.Map;

/**
 * Reads and writes the ledger file format.
 *
 * <p>Output is deterministic: properties in a fixed order, mods sorted by
 * slug, timestamps as ISO-8601 strings. Encoding a decoded document yields
 * the same bytes.</p>
 */
final class LedgerCodec {

    static final int CURRENT_SCHEMA_VERSION = 1;

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    @Nonnull
    byte[] encode(@Nonnull LedgerDocument document) throws IOException {
        return mapper.writeValueAsBytes(document);
    }

    /**
     * Decode a ledger file.
     *
     * @param bytes raw file content
     * @return the document, migrated to the current schema
     * @throws IOException if the content is not a ledger this version can read
     */
    @Nonnull
    LedgerDocument decode(@Nonnull byte[] bytes) throws IOException {
        LedgerDocument document = mapper.readValue(bytes, LedgerDocument.class);
        if (document == null) {
            throw new IOException("Ledger file is empty");
        }

        int schemaVersion = document.getSchemaVersion() != null ? document.getSchemaVersion() : 1;
        if (schemaVersion < 1 || schemaVersion > CURRENT_SCHEMA_VERSION) {
            throw new IOException("Unsupported ledger schema version " + schemaVersion);
        }
        document.setSchemaVersion(CURRENT_SCHEMA_VERSION);

        for (Map.Entry<String, InstalledMod> entry : document.getMods().entrySet()) {
            if (entry.getValue() == null) {
                throw new IOException("Ledger entry '" + entry.getKey() + "' is empty");
            }
            if (entry.getValue().getSlug() == null) {
                entry.getValue().setSlug(entry.getKey());
            }
        }
        return document;
    }

    @Nonnull
    static LedgerDocument empty() {
        LedgerDocument document = new LedgerDocument();
        document.setSchemaVersion(CURRENT_SCHEMA_VERSION);
        return document;
    }
}
