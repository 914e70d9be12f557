package com.ryuqq.chatcommand.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.chatcommand.core.statemachine.DispatchState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * <ul>
 *   <li>정상 경로 PREFIX_MATCH → ... → COMPLETED 성공</li>
 *   <li>단계 건너뛰기/역방향 전이 시 IllegalStateException</li>
 *   <li>종료 상태에서의 전이 시 IllegalStateException</li>
 *   <li>PREFIX_MATCH에서는 FAILED가 아니라 IGNORED만 허용</li>
 * </ul>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void transition_FullPipelineToCompleted_Succeeds() {
        // Given
        DispatchState state = PREFIX_MATCH;

        // When
        state = StateTransition.transition(state, LOOKUP);
        state = StateTransition.transition(state, TOKENIZE);
        state = StateTransition.transition(state, BIND);
        state = StateTransition.transition(state, GUARD);
        state = StateTransition.transition(state, COOLDOWN);
        state = StateTransition.transition(state, INVOKE);
        state = StateTransition.transition(state, COMPLETED);

        // Then
        assertEquals(COMPLETED, state);
        assertTrue(state.isTerminal());
    }

    @Test
    void validate_AnyStageAfterPrefixToFailed_Succeeds() {
        for (DispatchState from : new DispatchState[]{LOOKUP, TOKENIZE, BIND, GUARD, COOLDOWN, INVOKE}) {
            assertDoesNotThrow(() -> StateTransition.validate(from, FAILED), "from " + from);
        }
    }

    @Test
    void validate_AnyNonTerminalToCancelled_Succeeds() {
        for (DispatchState from : DispatchState.values()) {
            if (!from.isTerminal()) {
                assertDoesNotThrow(() -> StateTransition.validate(from, CANCELLED), "from " + from);
            }
        }
    }

    @Test
    void validate_PrefixMatchToIgnored_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(PREFIX_MATCH, IGNORED));
    }

    // ========== 불법 전이 테스트 ==========

    @Test
    void validate_PrefixMatchToFailed_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(PREFIX_MATCH, FAILED)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_SkippingStage_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(TOKENIZE, GUARD));
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(LOOKUP, INVOKE));
    }

    @Test
    void validate_Backwards_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(GUARD, BIND));
    }

    @Test
    void validate_LookupToIgnored_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(LOOKUP, IGNORED));
    }

    @Test
    void validate_FromTerminalState_ThrowsException() {
        for (DispatchState terminal : new DispatchState[]{COMPLETED, FAILED, IGNORED, CANCELLED}) {
            IllegalStateException exception = assertThrows(
                IllegalStateException.class,
                () -> StateTransition.validate(terminal, CANCELLED)
            );
            assertTrue(exception.getMessage().contains("terminal"));
        }
    }

    // ========== null 검증 ==========

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(null, LOOKUP));
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(LOOKUP, null));
    }

    @Test
    void next_TerminalStates_ReturnNull() {
        assertNull(COMPLETED.next());
        assertNull(CANCELLED.next());
        assertEquals(INVOKE, COOLDOWN.next());
    }
}
