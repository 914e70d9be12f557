/**
 * Dispatch outcomes.
 *
 * <p>{@link com.ryuqq.chatcommand.core.outcome.DispatchOutcome} is a sealed hierarchy with one
 * case per terminal dispatch state.</p>
 *
 * @since 1.0.0
 * @author ChatCommand Team
 */
package com.ryuqq.chatcommand.core.outcome;
