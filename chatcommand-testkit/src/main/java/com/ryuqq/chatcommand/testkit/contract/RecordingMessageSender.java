package com.ryuqq.chatcommand.testkit.contract;

import com.ryuqq.chatcommand.core.context.CommandContext;
import com.ryuqq.chatcommand.core.spi.MessageSender;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link MessageSender} that keeps sent messages in memory.
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class RecordingMessageSender implements MessageSender {

    private final List<Sent> sent = new CopyOnWriteArrayList<>();

    @Override
    public void send(CommandContext context, String text) {
        sent.add(new Sent(context.channelId(), text));
    }

    public List<Sent> sent() {
        return List.copyOf(sent);
    }

    /**
     * Sent texts in order.
     */
    public List<String> texts() {
        return sent.stream().map(Sent::text).toList();
    }

    public void clear() {
        sent.clear();
    }

    /**
     * @param channelId target channel
     * @param text message text
     */
    public record Sent(String channelId, String text) {
    }
}
