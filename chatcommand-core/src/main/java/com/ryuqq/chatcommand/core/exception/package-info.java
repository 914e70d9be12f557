/**
 * Error taxonomy.
 *
 * <p>Every failure after prefix matching is exactly one subclass of
 * {@link com.ryuqq.chatcommand.core.exception.CommandException}. The dispatcher recovers all of
 * them and hands them to the error reporter; {@code CommandExistsError} is the exception, thrown
 * synchronously to whoever registers a colliding command.</p>
 *
 * <p>Configuration mistakes (invalid parameter model, unknown converter type, null arguments)
 * are not part of the taxonomy and raise {@link java.lang.IllegalArgumentException} at build time.</p>
 *
 * @since 1.0.0
 * @author ChatCommand Team
 */
package com.ryuqq.chatcommand.core.exception;
