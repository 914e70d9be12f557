package com.ryuqq.chatcommand.core.spi;

import com.ryuqq.chatcommand.core.context.CommandContext;

import java.util.Optional;

/**
 * 외부 엔티티 조회 SPI (Service Provider Interface).
 *
 * <p>사용자/채널 디렉터리 등 코어 밖의 데이터 소스를 조회합니다.
 * 코어는 결과를 불투명한 값으로 취급하며 직접 네트워크 요청을 하지 않습니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>찾지 못한 경우 {@link Optional#empty()} 반환 (예외 아님)</li>
 *   <li>블로킹 조회 허용. 인터럽트 시 {@link InterruptedException}을 전파</li>
 * </ul>
 *
 * @param <E> 엔티티 타입
 * @author ChatCommand Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EntityResolver<E> {

    /**
     * 토큰으로 엔티티 조회.
     *
     * @param context 현재 호출 컨텍스트
     * @param token 조회 키 (멘션 접두사 {@code @}는 제거된 상태)
     * @return 엔티티 (없으면 empty)
     * @throws Exception 조회 실패 시
     */
    Optional<E> resolve(CommandContext context, String token) throws Exception;
}
