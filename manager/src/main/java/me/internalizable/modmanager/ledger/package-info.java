/**
 * Persistent record of installed mods.
 *
 * <p>The ledger is a JSON file next to the server's mods directory. It is
 * rewritten after every change and carries a schema version for future
 * migrations.</p>
 */
package me.internalizable.modmanager.ledger;
