package com.ryuqq.chatcommand.core.exception;

/**
 * 명령 처리 실패의 최상위 예외.
 *
 * <p>Dispatcher는 이 계층의 예외만 {@code ErrorReporter}로 전달합니다.
 * 모든 하위 예외는 unchecked이며, 메시지 처리 단위(per-message task) 밖으로 전파되지 않습니다.</p>
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>{@link CommandNotFound}: 조회 실패</li>
 *   <li>{@link CommandExistsError}: 등록 시 이름/별칭 충돌 (등록자에게 동기적으로 던짐)</li>
 *   <li>{@link ArgumentParsingFailed}: 토큰화 단계의 잘못된 입력</li>
 *   <li>{@link MissingRequiredArgument}: 필수 파라미터 누락</li>
 *   <li>{@link BadArgument} / {@link ConversionError}: 변환 실패</li>
 *   <li>{@link CheckFailure}: Guard 거부</li>
 *   <li>{@link CommandOnCooldown}: Cooldown 거부</li>
 *   <li>{@link CommandInvokeError}: 명령 본문에서 발생한 예외 래핑</li>
 * </ul>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public abstract class CommandException extends RuntimeException {

    protected CommandException(String message) {
        super(message);
    }

    protected CommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
