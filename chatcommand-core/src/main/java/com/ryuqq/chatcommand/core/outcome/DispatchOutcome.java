package com.ryuqq.chatcommand.core.outcome;

/**
 * 메시지 한 건의 처리 결과.
 *
 * <ul>
 *   <li>{@link Completed}: 명령 본문까지 정상 완료</li>
 *   <li>{@link Failed}: 오류 분류 값 하나로 실패 (ErrorReporter에 보고됨)</li>
 *   <li>{@link Ignored}: 접두사 불일치, 명령 메시지가 아님</li>
 *   <li>{@link Cancelled}: 인터럽트로 중단 (보고 없음)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스가 컴파일 타임에 고정됩니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public sealed interface DispatchOutcome permits Completed, Failed, Ignored, Cancelled {

    default boolean isCompleted() {
        return this instanceof Completed;
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }

    default boolean isIgnored() {
        return this instanceof Ignored;
    }

    default boolean isCancelled() {
        return this instanceof Cancelled;
    }
}
