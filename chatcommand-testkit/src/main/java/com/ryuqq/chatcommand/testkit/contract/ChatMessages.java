package com.ryuqq.chatcommand.testkit.contract;

import com.ryuqq.chatcommand.core.model.ChatMessage;
import com.ryuqq.chatcommand.core.model.Chatter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Test message factory.
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class ChatMessages {

    public static final String CHANNEL_ID = "channel-1";
    public static final Instant RECEIVED_AT = Instant.parse("2024-01-01T00:00:00Z");

    public static final Chatter VIEWER = new Chatter("1001", "alice", "Alice", false, false);
    public static final Chatter OTHER_VIEWER = new Chatter("1002", "bob", "Bob", false, false);
    public static final Chatter MODERATOR = new Chatter("2001", "mod", "Mod", true, false);
    public static final Chatter BROADCASTER = new Chatter("3001", "streamer", "Streamer", false, true);

    private static final AtomicLong SEQUENCE = new AtomicLong();

    // Utility class - prevent instantiation
    private ChatMessages() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Message from {@link #VIEWER} in {@link #CHANNEL_ID}.
     */
    public static ChatMessage of(String text) {
        return from(VIEWER, text);
    }

    public static ChatMessage from(Chatter chatter, String text) {
        return in(CHANNEL_ID, chatter, text);
    }

    public static ChatMessage in(String channelId, Chatter chatter, String text) {
        return new ChatMessage("msg-" + SEQUENCE.incrementAndGet(), channelId, chatter, text, RECEIVED_AT);
    }
}
