package com.ryuqq.chatcommand.core.spi;

import com.ryuqq.chatcommand.core.model.ChatMessage;

import java.util.Arrays;
import java.util.List;

/**
 * 명령 접두사 제공 SPI.
 *
 * <p>고정 목록({@link #of(String...)}) 또는 메시지마다 계산한 목록을 반환합니다.
 * Dispatcher는 반환 순서대로 비교하며 처음 일치한 접두사를 사용합니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PrefixProvider {

    /**
     * 메시지에 적용할 접두사 목록.
     *
     * @param message 수신 메시지
     * @return 접두사 목록 (빈 문자열은 무시됨)
     * @throws Exception 계산 실패 시 (Dispatcher는 "접두사 불일치"로 처리)
     */
    List<String> prefixes(ChatMessage message) throws Exception;

    /**
     * 고정 접두사 제공자 생성.
     *
     * @param prefixes 접두사 목록 (비교 순서)
     * @return PrefixProvider
     * @throws IllegalArgumentException prefixes가 비어 있거나 빈 문자열을 포함하는 경우
     */
    static PrefixProvider of(String... prefixes) {
        if (prefixes == null || prefixes.length == 0) {
            throw new IllegalArgumentException("prefixes cannot be empty");
        }
        for (String prefix : prefixes) {
            if (prefix == null || prefix.isEmpty()) {
                throw new IllegalArgumentException("prefix cannot be null or empty");
            }
        }
        List<String> fixed = List.copyOf(Arrays.asList(prefixes));
        return message -> fixed;
    }
}
