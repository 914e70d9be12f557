package com.ryuqq.chatcommand.application.dispatcher;

import com.ryuqq.chatcommand.core.model.ChatMessage;
import com.ryuqq.chatcommand.core.outcome.DispatchOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * 채팅 메시지를 명령 호출로 바꾸는 진입점.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DispatchOutcome outcome = dispatcher.dispatch(message);
 *
 * if (outcome instanceof Failed failed) {
 *     // 이미 ErrorReporter에 보고됨
 *     log.debug("{} failed at {}", failed.context().getInvokedWith(), failed.failedAt());
 * }
 *
 * // 전송 계층의 수신 스레드를 막지 않으려면
 * dispatcher.dispatchAsync(message);
 * </pre>
 *
 * <p><strong>보장 사항:</strong></p>
 * <ul>
 *   <li>명령 처리 중의 오류는 반환값(DispatchOutcome)으로만 나타나며 호출자에게 던져지지 않음</li>
 *   <li>FAILED로 끝난 호출은 ErrorReporter가 정확히 한 번 호출됨</li>
 *   <li>접두사가 일치하지 않는 메시지는 조용히 무시됨 (Ignored)</li>
 * </ul>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public interface Dispatcher {

    /**
     * 호출자 스레드에서 메시지 처리.
     *
     * <p>명령 본문이 끝날 때까지 블로킹합니다. 호출자 스레드가 인터럽트되면
     * Cancelled를 반환하고 인터럽트 플래그를 복원합니다.</p>
     *
     * @param message 수신 메시지
     * @return 처리 결과
     * @throws IllegalArgumentException message가 null인 경우
     */
    DispatchOutcome dispatch(ChatMessage message);

    /**
     * 작업 스레드 풀에서 메시지 처리.
     *
     * <p>반환된 future를 {@code cancel(true)}하면 실행 중인 작업이 인터럽트되어 취소됩니다.</p>
     *
     * @param message 수신 메시지
     * @return 처리 결과 future (예외로 완료되지 않음, 취소 시 CancellationException)
     * @throws IllegalArgumentException message가 null인 경우
     * @throws java.util.concurrent.RejectedExecutionException 종료된 Dispatcher인 경우
     */
    CompletableFuture<DispatchOutcome> dispatchAsync(ChatMessage message);
}
