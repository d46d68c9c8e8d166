package me.internalizable.modmanager.registry.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;

/**
 * Stability tier of a version, ordered from most to least stable.
 */
public enum VersionType {
    RELEASE("release", 0),
    BETA("beta", 1),
    ALPHA("alpha", 2),
    OTHER("other", 3);

    private final String id;
    private final int rank;

    VersionType(String id, int rank) {
        this.id = id;
        this.rank = rank;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Get the sort rank; lower is more stable.
     *
     * @return rank
     */
    public int rank() {
        return rank;
    }

    @Nonnull
    @JsonCreator
    public static VersionType fromId(@Nullable String id) {
        if (id == null) {
            return OTHER;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (VersionType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
