package me.internalizable.modmanager.environment;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Target environment every install is resolved against: one game version and one loader.
 *
 * @param gameVersion game version, e.g. {@code 1.20.1}
 * @param loader mod loader
 */
public record ServerEnvironment(@Nonnull String gameVersion, @Nonnull ModLoader loader) {

    public ServerEnvironment {
        Objects.requireNonNull(gameVersion, "gameVersion");
        Objects.requireNonNull(loader, "loader");
    }

    @Override
    public String toString() {
        return "Minecraft " + gameVersion + " (" + loader.getId() + ")";
    }
}
