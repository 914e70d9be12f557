package com.ryuqq.chatcommand.adapter.runner;

/**
 * CommandDispatcher 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 비동기 dispatch 작업 스레드 수 (기본 4)</li>
 *   <li>shutdownTimeoutMs: shutdown 시 진행 중인 작업을 기다리는 최대 시간 (기본 10000ms)</li>
 * </ul>
 *
 * <p>동기 dispatch는 호출자 스레드에서 실행되므로 concurrency의 영향을 받지 않습니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 * @param concurrency 작업 스레드 수 (1 이상이어야 함)
 * @param shutdownTimeoutMs shutdown 대기 시간 (밀리초, 양수여야 함)
 */
public record DispatcherConfig(
    int concurrency,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=4, shutdownTimeoutMs=10000ms</p>
     */
    public DispatcherConfig() {
        this(4, 10_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DispatcherConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public DispatcherConfig withConcurrency(int concurrency) {
        return new DispatcherConfig(concurrency, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public DispatcherConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new DispatcherConfig(concurrency, shutdownTimeoutMs);
    }
}
