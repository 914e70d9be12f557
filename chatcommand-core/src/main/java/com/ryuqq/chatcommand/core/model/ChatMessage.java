package com.ryuqq.chatcommand.core.model;

import java.time.Instant;

/**
 * 수신된 채팅 메시지.
 *
 * <p>전송 방식(websocket, webhook 등)과 무관한 형태로 Dispatcher에 전달됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ChatMessage message = ChatMessage.of(
 *     "channel-1",
 *     Chatter.of("1001", "alice"),
 *     "!greet bob"
 * );
 * </pre>
 *
 * @param id 메시지 ID (null이면 빈 문자열)
 * @param channelId 채널(방송자) ID
 * @param chatter 보낸 사용자
 * @param text 원본 메시지 본문
 * @param receivedAt 수신 시각
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public record ChatMessage(
    String id,
    String channelId,
    Chatter chatter,
    String text,
    Instant receivedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public ChatMessage {
        if (id == null) {
            id = "";
        }
        if (channelId == null || channelId.isBlank()) {
            throw new IllegalArgumentException("channelId cannot be null or blank");
        }
        if (chatter == null) {
            throw new IllegalArgumentException("chatter cannot be null");
        }
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (receivedAt == null) {
            throw new IllegalArgumentException("receivedAt cannot be null");
        }
    }

    /**
     * 현재 시각으로 메시지 생성.
     *
     * @param channelId 채널 ID
     * @param chatter 보낸 사용자
     * @param text 메시지 본문
     * @return ChatMessage 인스턴스
     */
    public static ChatMessage of(String channelId, Chatter chatter, String text) {
        return new ChatMessage("", channelId, chatter, text, Instant.now());
    }
}
