package com.ryuqq.chatcommand.core.statemachine;

/**
 * 메시지 한 건의 처리 단계.
 *
 * <p><strong>정상 경로:</strong></p>
 * <pre>
 * PREFIX_MATCH → LOOKUP → TOKENIZE → BIND → GUARD → COOLDOWN → INVOKE → COMPLETED
 * </pre>
 *
 * <p><strong>종료 상태:</strong></p>
 * <ul>
 *   <li>COMPLETED: 명령 본문과 after 훅까지 정상 완료</li>
 *   <li>FAILED: 오류 분류 값 하나를 가지고 종료 (ErrorReporter 1회 호출)</li>
 *   <li>IGNORED: 접두사 불일치 (보고 없음)</li>
 *   <li>CANCELLED: 인터럽트로 중단 (보고 없음, cooldown 미반영)</li>
 * </ul>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public enum DispatchState {

    PREFIX_MATCH,
    LOOKUP,
    TOKENIZE,
    BIND,
    GUARD,
    COOLDOWN,
    INVOKE,
    COMPLETED,
    FAILED,
    IGNORED,
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, FAILED, IGNORED, CANCELLED이면 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == IGNORED || this == CANCELLED;
    }

    /**
     * 정상 경로상의 다음 단계.
     *
     * @return 다음 단계 (종료 상태이면 null)
     */
    public DispatchState next() {
        return switch (this) {
            case PREFIX_MATCH -> LOOKUP;
            case LOOKUP -> TOKENIZE;
            case TOKENIZE -> BIND;
            case BIND -> GUARD;
            case GUARD -> COOLDOWN;
            case COOLDOWN -> INVOKE;
            case INVOKE -> COMPLETED;
            case COMPLETED, FAILED, IGNORED, CANCELLED -> null;
        };
    }
}
