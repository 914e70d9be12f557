/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Interfaces implemented outside the core: message transport, entity lookup, error
 * reporting, prefix resolution, invocation hooks and the command registry.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.chatcommand.core.spi.CommandRegistry} - name/alias indexed command lookup</li>
 *   <li>{@link com.ryuqq.chatcommand.core.spi.EntityResolver} - opaque lookup of users, channels and other entities</li>
 *   <li>{@link com.ryuqq.chatcommand.core.spi.ErrorReporter} - receives exactly one error per failed invocation</li>
 *   <li>{@link com.ryuqq.chatcommand.core.spi.MessageSender} - replies from command bodies</li>
 *   <li>{@link com.ryuqq.chatcommand.core.spi.PrefixProvider} - static or per-message command prefixes</li>
 *   <li>{@link com.ryuqq.chatcommand.core.spi.InvocationHook} - before/after invoke callbacks</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (e.g. chatcommand-adapter-inmemory) provide registry implementations;
 * transports provide the sender and resolvers.</p>
 *
 * @since 1.0.0
 * @author ChatCommand Team
 */
package com.ryuqq.chatcommand.core.spi;
