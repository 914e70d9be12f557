package com.ryuqq.chatcommand.core.statemachine;

/**
 * Dispatch 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>비종료 상태 → 정상 경로상의 다음 단계 ({@link DispatchState#next()})</li>
 *   <li>PREFIX_MATCH → IGNORED</li>
 *   <li>LOOKUP ~ INVOKE → FAILED</li>
 *   <li>비종료 상태 → CANCELLED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태에서는 어떤 상태로도 전이 불가</li>
 *   <li>단계를 건너뛰거나 되돌아갈 수 없음</li>
 *   <li>접두사 불일치는 FAILED가 아니라 IGNORED (보고 대상 아님)</li>
 * </ul>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(DispatchState from, DispatchState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (to) {
            case CANCELLED -> true;
            case IGNORED -> from == DispatchState.PREFIX_MATCH;
            case FAILED -> from != DispatchState.PREFIX_MATCH;
            default -> from.next() == to;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static DispatchState transition(DispatchState current, DispatchState next) {
        validate(current, next);
        return next;
    }
}
