/**
 * Mod manager for Minecraft servers.
 *
 * <p>Installs mods from the Modrinth registry into a server's mods directory,
 * pulls in their dependencies, records them in a local ledger and keeps
 * them up to date on a schedule.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link me.internalizable.modmanager.ModManager} - Owns and wires every component</li>
 *   <li>{@link me.internalizable.modmanager.registry.ModrinthClient} - Registry access with response caching</li>
 *   <li>{@link me.internalizable.modmanager.resolve.DependencyResolver} - Builds install plans</li>
 *   <li>{@link me.internalizable.modmanager.ledger.StateLedger} - Durable record of installed mods</li>
 *   <li>{@link me.internalizable.modmanager.install.ModInstaller} - Installs, updates and removes mods</li>
 *   <li>{@link me.internalizable.modmanager.update.AutoUpdater} - Scheduled updates and their audit log</li>
 * </ul>
 *
 * @see me.internalizable.modmanager.api.ModManagerAPI
 */
package me.internalizable.modmanager;
