package me.internalizable.modmanager.registry;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Failure talking to the remote registry.
 */
public class RegistryException extends Exception {

    private final Kind kind;

    public RegistryException(@Nonnull Kind kind, @Nonnull String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public RegistryException(@Nonnull Kind kind, @Nonnull String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    /**
     * Categories of registry failures.
     */
    public enum Kind {
        /**
         * Connection could not be established or broke mid-transfer.
         */
        NETWORK,

        /**
         * The request did not complete within its timeout.
         */
        TIMEOUT,

        /**
         * The registry answered 429.
         */
        RATE_LIMITED,

        /**
         * The requested project or version does not exist.
         */
        NOT_FOUND,

        /**
         * Any other non-success status.
         */
        HTTP_ERROR,

        /**
         * The response body could not be decoded.
         */
        MALFORMED_RESPONSE,

        /**
         * A project URL that does not point at the registry.
         */
        INVALID_REFERENCE
    }
}
