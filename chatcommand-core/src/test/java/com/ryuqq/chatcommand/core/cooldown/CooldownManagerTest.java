package com.ryuqq.chatcommand.core.cooldown;

import com.ryuqq.chatcommand.core.context.CommandContext;
import com.ryuqq.chatcommand.core.exception.CommandOnCooldown;
import com.ryuqq.chatcommand.core.fixture.TestContexts;
import com.ryuqq.chatcommand.core.model.Chatter;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CooldownManager 테스트.
 *
 * <p><strong>테스트 범위:</strong></p>
 * <ul>
 *   <li>여러 쿨다운 중 하나라도 거부하면 아무것도 차감하지 않음</li>
 *   <li>거부 시 가장 긴 대기 시간을 보고</li>
 *   <li>동시 요청에서도 허용량을 초과하지 않음</li>
 *   <li>오래된 상태 정리</li>
 * </ul>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
class CooldownManagerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static CommandContext contextOf(String id, String login) {
        return TestContexts.context(new Chatter(id, login, login, false, false));
    }

    private static CooldownManager manager(CooldownSpec... specs) {
        return new CooldownManager("test", List.of(specs), CooldownManagerConfig.defaultConfig());
    }

    @Test
    void acquire_거부되면_다른_쿨다운도_차감하지_않음() {
        // given: 채널 전체 2회, 사용자별 1회
        CooldownManager manager = manager(
            CooldownSpec.fixedWindow(2, Duration.ofSeconds(30), BucketType.CHANNEL),
            CooldownSpec.fixedWindow(1, Duration.ofSeconds(30), BucketType.USER)
        );
        CommandContext alice = contextOf("1", "alice");
        CommandContext bob = contextOf("2", "bob");
        CommandContext carol = contextOf("3", "carol");

        // when
        manager.acquire(alice, T0);
        assertThatThrownBy(() -> manager.acquire(alice, T0.plusSeconds(1)))
            .isInstanceOf(CommandOnCooldown.class);

        // then: 채널 버킷은 한 번만 차감되어 bob은 통과, carol은 거부
        assertThatCode(() -> manager.acquire(bob, T0.plusSeconds(2))).doesNotThrowAnyException();
        assertThatThrownBy(() -> manager.acquire(carol, T0.plusSeconds(3)))
            .isInstanceOf(CommandOnCooldown.class);
    }

    @Test
    void acquire_가장_긴_대기_시간을_보고() {
        CooldownManager manager = manager(
            CooldownSpec.gcra(1, Duration.ofSeconds(5), BucketType.DEFAULT),
            CooldownSpec.gcra(1, Duration.ofSeconds(60), BucketType.USER)
        );
        CommandContext context = TestContexts.context();
        manager.acquire(context, T0);

        assertThatThrownBy(() -> manager.acquire(context, T0.plusSeconds(1)))
            .isInstanceOf(CommandOnCooldown.class)
            .satisfies(e -> {
                CommandOnCooldown cooldown = (CommandOnCooldown) e;
                assertThat(cooldown.getRetryAfter()).isEqualTo(Duration.ofSeconds(59));
                assertThat(cooldown.getCommandName()).isEqualTo("test");
            });
    }

    @Test
    void acquire_버킷_키가_null이면_쿨다운_우회() {
        CooldownManager manager = manager(CooldownSpec.fixedWindow(1, Duration.ofSeconds(30), ctx -> null));
        CommandContext context = TestContexts.context();

        manager.acquire(context, T0);

        assertThatCode(() -> manager.acquire(context, T0)).doesNotThrowAnyException();
        assertThat(manager.trackedKeys()).isZero();
    }

    @Test
    void acquire_동시_요청에서_정확히_허용량만_통과() throws Exception {
        // given
        CooldownManager manager = manager(CooldownSpec.fixedWindow(1, Duration.ofSeconds(30), BucketType.DEFAULT));
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < threads; i++) {
            CommandContext context = contextOf(String.valueOf(i), "user" + i);
            futures.add(executor.submit(() -> {
                start.await();
                try {
                    manager.acquire(context, T0);
                    admitted.incrementAndGet();
                } catch (CommandOnCooldown ignored) {
                    // 거부는 정상 결과
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // then
        assertThat(admitted.get()).isEqualTo(1);
    }

    @Test
    void peek_상태를_변경하지_않음() {
        CooldownManager manager = manager(CooldownSpec.gcra(1, Duration.ofSeconds(10), BucketType.USER));
        CommandContext context = TestContexts.context();

        assertThat(manager.peek(context, T0)).isEmpty();
        assertThat(manager.trackedKeys()).isZero();

        manager.acquire(context, T0);

        assertThat(manager.peek(context, T0.plusSeconds(4))).contains(Duration.ofSeconds(6));
        assertThat(manager.isRateLimited(context, T0.plusSeconds(10))).isFalse();
    }

    @Test
    void acquire_정리_주기마다_오래된_상태를_제거() {
        // given
        CooldownManager manager = new CooldownManager(
            "test",
            List.of(CooldownSpec.gcra(1, Duration.ofSeconds(10), BucketType.USER)),
            CooldownManagerConfig.defaultConfig().withSweepIntervalMs(0)
        );
        manager.acquire(contextOf("1", "alice"), T0);
        assertThat(manager.trackedKeys()).isEqualTo(1);

        // when
        manager.acquire(contextOf("2", "bob"), T0.plusSeconds(20));

        // then
        assertThat(manager.trackedKeys()).isEqualTo(1);
    }

    @Test
    void reset_모든_상태를_제거() {
        CooldownManager manager = manager(CooldownSpec.gcra(1, Duration.ofSeconds(10), BucketType.USER));
        CommandContext context = TestContexts.context();
        manager.acquire(context, T0);

        manager.reset();

        assertThat(manager.trackedKeys()).isZero();
        assertThatCode(() -> manager.acquire(context, T0)).doesNotThrowAnyException();
    }

    @Test
    void bucketType_키_구성() {
        CommandContext context = TestContexts.context();

        assertThat(BucketType.DEFAULT.key(context)).isEqualTo(BucketType.DEFAULT);
        assertThat(BucketType.USER.key(context)).isEqualTo(List.of("user", "1001"));
        assertThat(BucketType.CHANNEL.key(context)).isEqualTo(List.of("channel", "channel-1"));
        assertThat(BucketType.CHATTER.key(context)).isEqualTo(List.of("channel-1", "1001"));
    }
}
