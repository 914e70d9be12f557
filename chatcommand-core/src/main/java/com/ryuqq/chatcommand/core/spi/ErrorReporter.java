package com.ryuqq.chatcommand.core.spi;

import com.ryuqq.chatcommand.core.context.CommandContext;
import com.ryuqq.chatcommand.core.exception.CommandException;

/**
 * 실패한 호출의 오류 보고 SPI.
 *
 * <p>FAILED로 끝난 호출마다 등록된 보고기별로 정확히 한 번 호출됩니다.
 * 명령과 컴포넌트에 등록한 보고기가 먼저, Dispatcher 전역 보고기가 마지막입니다.
 * 접두사 불일치(IGNORED)와 취소(CANCELLED)는 보고하지 않습니다.</p>
 *
 * <p>구현이 던진 예외는 Dispatcher가 잡아서 로그로 남기며, 호출자에게 전파되지 않습니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ErrorReporter {

    /**
     * 오류 보고.
     *
     * @param context 실패한 호출의 컨텍스트 (상태는 FAILED)
     * @param error 오류 분류 값
     */
    void report(CommandContext context, CommandException error);
}
