package me.internalizable.modmanager.registry.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;

/**
 * How a version relates to one of its declared dependencies.
 */
public enum DependencyType {
    REQUIRED("required"),
    OPTIONAL("optional"),
    INCOMPATIBLE("incompatible"),
    EMBEDDED("embedded"),
    UNKNOWN("unknown");

    private final String id;

    DependencyType(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @Nonnull
    @JsonCreator
    public static DependencyType fromId(@Nullable String id) {
        if (id == null) {
            return UNKNOWN;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (DependencyType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
