/**
 * Dispatch state machine.
 *
 * <p>Every inbound message walks {@link com.ryuqq.chatcommand.core.statemachine.DispatchState}
 * from {@code PREFIX_MATCH} to exactly one terminal state. Transitions are validated by
 * {@link com.ryuqq.chatcommand.core.statemachine.StateTransition}; an illegal transition is a
 * programming error and raises {@link java.lang.IllegalStateException}.</p>
 *
 * @since 1.0.0
 * @author ChatCommand Team
 */
package com.ryuqq.chatcommand.core.statemachine;
