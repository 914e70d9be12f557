package com.ryuqq.chatcommand.core.spi;

import com.ryuqq.chatcommand.core.contract.Command;
import com.ryuqq.chatcommand.core.contract.Component;

import java.util.Collection;
import java.util.Optional;

/**
 * 명령 레지스트리 SPI.
 *
 * <p>최상위 명령을 이름과 별칭으로 색인합니다. 하위 명령은 그룹 명령
 * ({@link Command#findSubcommand(String, boolean)})이 직접 보관합니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>이름/별칭 충돌 시 {@code CommandExistsError}, 레지스트리는 변경하지 않음</li>
 *   <li>등록 해제는 모든 별칭을 한 번에 제거 (원자적)</li>
 *   <li>조회는 항상 완전한 스냅샷을 관찰 (부분 등록 상태 노출 금지)</li>
 *   <li>모든 메서드 thread-safe</li>
 * </ul>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public interface CommandRegistry {

    /**
     * 최상위 명령 등록.
     *
     * @param command 명령
     * @throws IllegalArgumentException command가 null인 경우
     * @throws com.ryuqq.chatcommand.core.exception.CommandExistsError 이름/별칭 충돌
     */
    void register(Command command);

    /**
     * 이름(또는 별칭)으로 명령 등록 해제.
     *
     * @param name 명령 이름 또는 별칭
     * @return 제거된 명령 (없으면 empty)
     */
    Optional<Command> unregister(String name);

    /**
     * 컴포넌트의 모든 명령을 원자적으로 등록.
     *
     * <p>하나라도 충돌하면 아무것도 등록하지 않습니다.</p>
     *
     * @param component 컴포넌트
     * @throws com.ryuqq.chatcommand.core.exception.CommandExistsError 충돌 시
     */
    void addComponent(Component component);

    /**
     * 컴포넌트와 그 명령 전체를 원자적으로 제거.
     *
     * @param name 컴포넌트 이름
     * @return 제거된 컴포넌트 (없으면 empty)
     */
    Optional<Component> removeComponent(String name);

    /**
     * 이름 또는 별칭으로 최상위 명령 조회.
     *
     * @param name 호출 이름
     * @return 명령 (없으면 empty)
     */
    Optional<Command> resolve(String name);

    /**
     * 등록된 최상위 명령 목록 (등록 순서).
     *
     * @return 불변 목록
     */
    Collection<Command> commands();

    /**
     * 대소문자 무시 조회 여부.
     *
     * @return 대소문자 무시이면 true
     */
    boolean isCaseInsensitive();
}
