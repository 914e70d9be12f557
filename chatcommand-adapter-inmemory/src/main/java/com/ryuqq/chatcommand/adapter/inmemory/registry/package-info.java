/**
 * In-memory command registry.
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.chatcommand.adapter.inmemory.registry.InMemoryCommandRegistry} - copy-on-write
 *       snapshot registry with lock-free lookups</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ChatCommand Team
 */
package com.ryuqq.chatcommand.adapter.inmemory.registry;
