/**
 * API for managing the mods of a Minecraft server.
 *
 * <p>Provides interfaces for installing, updating and removing mods,
 * searching the registry, and controlling scheduled auto-updates.</p>
 *
 * @see me.internalizable.modmanager.api.ModManagerAPI
 */
package me.internalizable.modmanager.api;
