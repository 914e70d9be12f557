package com.ryuqq.chatcommand.core.cooldown;

import com.ryuqq.chatcommand.core.context.CommandContext;

import java.util.List;

/**
 * 기본 제공 Bucket.
 *
 * <ul>
 *   <li>DEFAULT: 모든 채널과 사용자가 하나의 상태를 공유 (전역)</li>
 *   <li>USER: 사용자별, 채널과 무관</li>
 *   <li>CHANNEL: 채널별, 채널 안의 모든 사용자가 공유</li>
 *   <li>CHATTER: 채널 안의 사용자별</li>
 * </ul>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public enum BucketType implements Bucket {

    DEFAULT {
        @Override
        public Object key(CommandContext context) {
            return DEFAULT;
        }
    },
    USER {
        @Override
        public Object key(CommandContext context) {
            return List.of("user", context.chatter().id());
        }
    },
    CHANNEL {
        @Override
        public Object key(CommandContext context) {
            return List.of("channel", context.channelId());
        }
    },
    CHATTER {
        @Override
        public Object key(CommandContext context) {
            return List.of(context.channelId(), context.chatter().id());
        }
    }
}
