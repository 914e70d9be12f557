/**
 * Per-message invocation state.
 *
 * <p>{@link com.ryuqq.chatcommand.core.context.CommandContext} is created by the dispatcher for
 * every message whose prefix matched and is discarded once dispatch ends.</p>
 *
 * @since 1.0.0
 * @author ChatCommand Team
 */
package com.ryuqq.chatcommand.core.context;
