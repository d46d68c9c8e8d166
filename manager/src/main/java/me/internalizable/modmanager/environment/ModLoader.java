package me.internalizable.modmanager.environment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;

/**
 * Mod loader a server runs. Loaders are mutually exclusive within one server.
 */
public enum ModLoader {
    FABRIC("fabric"),
    FORGE("forge"),
    QUILT("quilt"),
    NEOFORGE("neoforge");

    private final String id;

    ModLoader(String id) {
        this.id = id;
    }

    /**
     * Get the identifier the registry uses for this loader.
     *
     * @return lowercase loader id
     */
    @Nonnull
    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Parse a loader identifier.
     *
     * @param id loader id, case-insensitive
     * @return the loader
     * @throws IllegalArgumentException if the id is unknown
     */
    @Nonnull
    public static ModLoader fromId(@Nonnull String id) {
        ModLoader loader = lookup(id);
        if (loader == null) {
            throw new IllegalArgumentException("Unknown mod loader: " + id);
        }
        return loader;
    }

    /**
     * Parse a loader identifier read from a stored document. Unknown or
     * missing ids yield null so a single bad entry does not fail the document.
     *
     * @param id loader id, case-insensitive
     * @return the loader, or null if unknown
     */
    @Nullable
    @JsonCreator
    public static ModLoader fromStoredId(@Nullable String id) {
        return id != null ? lookup(id) : null;
    }

    @Nullable
    private static ModLoader lookup(String id) {
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (ModLoader loader : values()) {
            if (loader.id.equals(normalized)) {
                return loader;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return id;
    }
}
