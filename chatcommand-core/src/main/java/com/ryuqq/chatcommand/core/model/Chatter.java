package com.ryuqq.chatcommand.core.model;

/**
 * 메시지를 보낸 채팅 사용자.
 *
 * <p>전송 계층(transport)이 채워 넣는 값이며, 코어는 원격 디렉터리 조회를 하지 않습니다.</p>
 *
 * @param id 사용자 고유 ID
 * @param login 로그인 이름 (소문자)
 * @param displayName 표시 이름 (null이면 login 사용)
 * @param moderator 해당 채널의 모더레이터 여부
 * @param broadcaster 해당 채널의 방송자(채널 소유자) 여부
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public record Chatter(
    String id,
    String login,
    String displayName,
    boolean moderator,
    boolean broadcaster
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id 또는 login이 null이거나 빈 문자열인 경우
     */
    public Chatter {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (login == null || login.isBlank()) {
            throw new IllegalArgumentException("login cannot be null or blank");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = login;
        }
    }

    /**
     * 일반 사용자 생성.
     *
     * @param id 사용자 ID
     * @param login 로그인 이름
     * @return Chatter 인스턴스
     */
    public static Chatter of(String id, String login) {
        return new Chatter(id, login, login, false, false);
    }
}
