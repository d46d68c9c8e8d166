/**
 * Client for the Modrinth v2 API.
 */
package me.internalizable.modmanager.registry;
