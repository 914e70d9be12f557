package com.ryuqq.chatcommand.core.guard;

import com.ryuqq.chatcommand.core.context.CommandContext;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * 기본 제공 Guard.
 *
 * <ul>
 *   <li>{@link #isOwner(String)}: 봇 소유자만 허용</li>
 *   <li>{@link #isModerator()}: 해당 채널의 모더레이터 (방송자 포함)</li>
 *   <li>{@link #isBroadcaster()}: 해당 채널의 방송자</li>
 *   <li>{@link #async(String, Function)}: 비동기 조회 결과를 기다리는 Guard</li>
 * </ul>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class Guards {

    // Utility class - prevent instantiation
    private Guards() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 봇 소유자 전용.
     *
     * @param ownerId 소유자 사용자 ID
     * @return Guard
     */
    public static Guard isOwner(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId cannot be null or blank");
        }
        return Guard.named("is_owner", context -> ownerId.equals(context.chatter().id()));
    }

    public static Guard isModerator() {
        return Guard.named("is_moderator",
            context -> context.chatter().moderator() || context.chatter().broadcaster());
    }

    public static Guard isBroadcaster() {
        return Guard.named("is_broadcaster", context -> context.chatter().broadcaster());
    }

    /**
     * 비동기 조회 결과를 기다리는 Guard.
     *
     * <p>대기 중 인터럽트되면 조회를 취소하고 {@link InterruptedException}을 전파합니다.
     * 조회가 예외로 끝나면 원인 예외를 그대로 던집니다.</p>
     *
     * @param name Guard 이름
     * @param query 조회 함수 (null 결과는 거부로 취급)
     * @return Guard
     */
    public static Guard async(String name, Function<CommandContext, ? extends CompletionStage<Boolean>> query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        return Guard.named(name, context -> {
            CompletableFuture<Boolean> future = query.apply(context).toCompletableFuture();
            try {
                return Boolean.TRUE.equals(future.get());
            } catch (InterruptedException e) {
                future.cancel(true);
                throw e;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception exception) {
                    throw exception;
                }
                throw e;
            }
        });
    }
}
