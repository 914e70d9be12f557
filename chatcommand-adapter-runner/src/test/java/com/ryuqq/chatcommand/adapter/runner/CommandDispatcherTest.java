package com.ryuqq.chatcommand.adapter.runner;

import com.ryuqq.chatcommand.adapter.inmemory.registry.InMemoryCommandRegistry;
import com.ryuqq.chatcommand.core.context.CommandContext;
import com.ryuqq.chatcommand.core.contract.Command;
import com.ryuqq.chatcommand.core.convert.ArgumentType;
import com.ryuqq.chatcommand.core.cooldown.BucketType;
import com.ryuqq.chatcommand.core.cooldown.CooldownSpec;
import com.ryuqq.chatcommand.core.exception.CheckFailure;
import com.ryuqq.chatcommand.core.exception.CommandException;
import com.ryuqq.chatcommand.core.exception.CommandHookError;
import com.ryuqq.chatcommand.core.exception.CommandInvokeError;
import com.ryuqq.chatcommand.core.exception.CommandNotFound;
import com.ryuqq.chatcommand.core.exception.CommandOnCooldown;
import com.ryuqq.chatcommand.core.guard.Guard;
import com.ryuqq.chatcommand.core.model.ChatMessage;
import com.ryuqq.chatcommand.core.model.Chatter;
import com.ryuqq.chatcommand.core.outcome.Cancelled;
import com.ryuqq.chatcommand.core.outcome.Completed;
import com.ryuqq.chatcommand.core.outcome.DispatchOutcome;
import com.ryuqq.chatcommand.core.outcome.Failed;
import com.ryuqq.chatcommand.core.spi.ErrorReporter;
import com.ryuqq.chatcommand.core.spi.InvocationHook;
import com.ryuqq.chatcommand.core.spi.MessageSender;
import com.ryuqq.chatcommand.core.statemachine.DispatchState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * CommandDispatcher 유닛 테스트.
 *
 * <p><strong>검증 범위:</strong></p>
 * <ul>
 *   <li>PREFIX_MATCH → ... → COMPLETED 정상 경로</li>
 *   <li>단계별 실패가 FAILED로 끝나고 reporter가 정확히 한 번 호출됨</li>
 *   <li>접두사 불일치는 IGNORED, reporter 미호출</li>
 *   <li>훅 실행 순서, 그룹 하위 명령 해석</li>
 *   <li>인터럽트 시 CANCELLED, 쿨다운 미차감, reporter 미호출</li>
 * </ul>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class CommandDispatcherTest {

    private static final Chatter VIEWER = Chatter.of("1001", "alice");

    @Mock
    private ErrorReporter errorReporter;

    private InMemoryCommandRegistry registry;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        registry = new InMemoryCommandRegistry();
        dispatcher = CommandDispatcher.builder(registry)
            .prefixes("!", "?")
            .errorReporter(errorReporter)
            .config(new DispatcherConfig(2, 1_000))
            .build();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        dispatcher.shutdown();
    }

    private static ChatMessage message(String text) {
        return ChatMessage.of("channel-1", VIEWER, text);
    }

    private CommandException reportedError() {
        ArgumentCaptor<CommandException> captor = ArgumentCaptor.forClass(CommandException.class);
        verify(errorReporter).report(any(CommandContext.class), captor.capture());
        return captor.getValue();
    }

    // ========== 정상 경로 ==========

    @Test
    void dispatch_명령을_실행하고_Completed_반환() {
        // given
        AtomicReference<Integer> received = new AtomicReference<>();
        registry.register(Command.builder("roll")
            .positional("sides", ArgumentType.of(Integer.class))
            .callback(ctx -> received.set(ctx.argument("sides", Integer.class)))
            .build());

        // when
        DispatchOutcome outcome = dispatcher.dispatch(message("!roll 20"));

        // then
        assertThat(outcome).isInstanceOf(Completed.class);
        CommandContext context = ((Completed) outcome).context();
        assertThat(context.getState()).isEqualTo(DispatchState.COMPLETED);
        assertThat(context.getInvokedWith()).isEqualTo("roll");
        assertThat(context.getPrefix()).isEqualTo("!");
        assertThat(received.get()).isEqualTo(20);
        verifyNoInteractions(errorReporter);
    }

    @Test
    void dispatch_두번째_접두사도_인식() {
        registry.register(Command.builder("ping").callback(ctx -> { }).build());

        DispatchOutcome outcome = dispatcher.dispatch(message("?ping"));

        assertThat(outcome.isCompleted()).isTrue();
        assertThat(((Completed) outcome).context().getPrefix()).isEqualTo("?");
    }

    @Test
    void dispatch_본문에서_send하면_MessageSender로_전달() throws Exception {
        // given
        List<String> sent = Collections.synchronizedList(new ArrayList<>());
        MessageSender sender = (ctx, text) -> sent.add(ctx.channelId() + ":" + text);
        CommandDispatcher withSender = CommandDispatcher.builder(registry)
            .prefixes("!")
            .messageSender(sender)
            .build();
        registry.register(Command.builder("echo")
            .consumeRest("text", ArgumentType.of(String.class))
            .callback(ctx -> ctx.send(ctx.argument("text", String.class)))
            .build());

        // when
        withSender.dispatch(message("!echo hello   world"));
        withSender.shutdown();

        // then
        assertThat(sent).containsExactly("channel-1:hello   world");
    }

    // ========== 무시 ==========

    @Test
    void dispatch_접두사가_없으면_Ignored_reporter_미호출() {
        DispatchOutcome outcome = dispatcher.dispatch(message("hello everyone"));

        assertThat(outcome.isIgnored()).isTrue();
        verifyNoInteractions(errorReporter);
    }

    @Test
    void dispatch_접두사_제공자_예외는_Ignored로_처리() {
        CommandDispatcher broken = CommandDispatcher.builder(registry)
            .prefixProvider(message -> {
                throw new IllegalStateException("settings unavailable");
            })
            .errorReporter(errorReporter)
            .build();

        DispatchOutcome outcome = broken.dispatch(message("!ping"));

        assertThat(outcome.isIgnored()).isTrue();
        verifyNoInteractions(errorReporter);
    }

    // ========== 실패 ==========

    @Test
    void dispatch_알수없는_명령은_LOOKUP에서_CommandNotFound() {
        // when
        DispatchOutcome outcome = dispatcher.dispatch(message("!nope 1 2"));

        // then
        assertThat(outcome).isInstanceOf(Failed.class);
        Failed failed = (Failed) outcome;
        assertThat(failed.failedAt()).isEqualTo(DispatchState.LOOKUP);
        assertThat(failed.error()).isInstanceOf(CommandNotFound.class);
        assertThat(((CommandNotFound) failed.error()).getInvokedWith()).isEqualTo("nope");
        assertThat(reportedError()).isSameAs(failed.error());
    }

    @Test
    void dispatch_접두사만_있으면_빈_이름으로_CommandNotFound() {
        DispatchOutcome outcome = dispatcher.dispatch(message("!"));

        assertThat(outcome.isFailed()).isTrue();
        assertThat(((CommandNotFound) ((Failed) outcome).error()).getInvokedWith()).isEmpty();
    }

    @Test
    void dispatch_본문_예외는_CommandInvokeError로_감싸기() {
        // given
        IllegalStateException failure = new IllegalStateException("boom");
        registry.register(Command.builder("explode").callback(ctx -> {
            throw failure;
        }).build());

        // when
        DispatchOutcome outcome = dispatcher.dispatch(message("!explode"));

        // then
        Failed failed = (Failed) outcome;
        assertThat(failed.failedAt()).isEqualTo(DispatchState.INVOKE);
        assertThat(failed.error()).isInstanceOf(CommandInvokeError.class);
        assertThat(((CommandInvokeError) failed.error()).getOriginal()).isSameAs(failure);
        assertThat(failed.error().getMessage()).contains("IllegalStateException: boom");
    }

    @Test
    void dispatch_가드_실패시_본문_미실행() {
        // given
        AtomicBoolean invoked = new AtomicBoolean();
        registry.register(Command.builder("secret")
            .guard(Guard.named("never", ctx -> false))
            .callback(ctx -> invoked.set(true))
            .build());

        // when
        DispatchOutcome outcome = dispatcher.dispatch(message("!secret"));

        // then
        assertThat(((Failed) outcome).failedAt()).isEqualTo(DispatchState.GUARD);
        assertThat(((Failed) outcome).error()).isInstanceOf(CheckFailure.class);
        assertThat(invoked).isFalse();
        verify(errorReporter).report(any(CommandContext.class), any(CheckFailure.class));
    }

    @Test
    void dispatch_전역_가드가_명령_가드보다_먼저() {
        // given
        List<String> evaluated = Collections.synchronizedList(new ArrayList<>());
        CommandDispatcher guarded = CommandDispatcher.builder(registry)
            .prefixes("!")
            .errorReporter(errorReporter)
            .guard(Guard.named("global", ctx -> evaluated.add("global")))
            .build();
        registry.register(Command.builder("ping")
            .guard(Guard.named("local", ctx -> evaluated.add("local")))
            .callback(ctx -> { })
            .build());

        // when
        DispatchOutcome outcome = guarded.dispatch(message("!ping"));

        // then
        assertThat(outcome.isCompleted()).isTrue();
        assertThat(evaluated).containsExactly("global", "local");
    }

    @Test
    void dispatch_reporter_예외는_삼키고_Failed_반환() {
        doThrow(new IllegalStateException("reporter down"))
            .when(errorReporter).report(any(CommandContext.class), any(CommandException.class));

        DispatchOutcome outcome = dispatcher.dispatch(message("!missing"));

        assertThat(outcome.isFailed()).isTrue();
    }

    @Test
    void dispatch_쿨다운_초과시_CommandOnCooldown() {
        registry.register(Command.builder("hug")
            .cooldown(CooldownSpec.gcra(1, Duration.ofMinutes(1), BucketType.USER))
            .callback(ctx -> { })
            .build());

        DispatchOutcome first = dispatcher.dispatch(message("!hug"));
        DispatchOutcome second = dispatcher.dispatch(message("!hug"));

        assertThat(first.isCompleted()).isTrue();
        assertThat(((Failed) second).failedAt()).isEqualTo(DispatchState.COOLDOWN);
        assertThat(((Failed) second).error()).isInstanceOf(CommandOnCooldown.class);
    }

    // ========== 훅 ==========

    @Test
    void dispatch_훅은_전역_명령_순으로_본문을_감싼다() {
        // given
        List<String> events = Collections.synchronizedList(new ArrayList<>());
        CommandDispatcher hooked = CommandDispatcher.builder(registry)
            .prefixes("!")
            .errorReporter(errorReporter)
            .hook(recordingHook("global", events))
            .build();
        registry.register(Command.builder("ping")
            .hook(recordingHook("command", events))
            .callback(ctx -> events.add("body"))
            .build());

        // when
        hooked.dispatch(message("!ping"));

        // then
        assertThat(events).containsExactly(
            "global:before", "command:before", "body", "global:after", "command:after");
    }

    @Test
    void dispatch_본문_실패시_after_훅_미실행() {
        List<String> events = Collections.synchronizedList(new ArrayList<>());
        registry.register(Command.builder("explode")
            .hook(recordingHook("command", events))
            .callback(ctx -> {
                throw new IllegalStateException("boom");
            })
            .build());

        dispatcher.dispatch(message("!explode"));

        assertThat(events).containsExactly("command:before");
    }

    @Test
    void dispatch_before_훅_실패는_CommandHookError() {
        AtomicBoolean invoked = new AtomicBoolean();
        registry.register(Command.builder("ping")
            .hook(new InvocationHook() {
                @Override
                public void before(CommandContext context) {
                    throw new IllegalStateException("audit offline");
                }
            })
            .callback(ctx -> invoked.set(true))
            .build());

        DispatchOutcome outcome = dispatcher.dispatch(message("!ping"));

        assertThat(((Failed) outcome).error()).isInstanceOf(CommandHookError.class);
        assertThat(invoked).isFalse();
    }

    private static InvocationHook recordingHook(String name, List<String> events) {
        return new InvocationHook() {
            @Override
            public void before(CommandContext context) {
                events.add(name + ":before");
            }

            @Override
            public void after(CommandContext context) {
                events.add(name + ":after");
            }
        };
    }

    // ========== 그룹 ==========

    @Test
    void dispatch_하위_명령을_해석하고_남은_텍스트를_인자로_사용() {
        // given
        AtomicReference<String> title = new AtomicReference<>();
        registry.register(Command.builder("settings")
            .subcommand(Command.builder("title")
                .consumeRest("value", ArgumentType.of(String.class))
                .callback(ctx -> title.set(ctx.argument("value", String.class))))
            .build());

        // when
        DispatchOutcome outcome = dispatcher.dispatch(message("!settings title Friday  stream"));

        // then
        assertThat(outcome.isCompleted()).isTrue();
        CommandContext context = ((Completed) outcome).context();
        assertThat(context.getCommand().getQualifiedName()).isEqualTo("settings title");
        assertThat(context.getSubcommandTrigger()).isEqualTo("title");
        assertThat(title.get()).isEqualTo("Friday  stream");
    }

    @Test
    void dispatch_일치하는_하위_명령이_없으면_그룹_콜백_실행() {
        AtomicReference<String> seen = new AtomicReference<>();
        registry.register(Command.builder("settings")
            .consumeRest("text", ArgumentType.optional(ArgumentType.of(String.class)))
            .subcommand(Command.builder("title").callback(ctx -> { }))
            .callback(ctx -> seen.set(ctx.argument("text", String.class)))
            .build());

        DispatchOutcome outcome = dispatcher.dispatch(message("!settings unknown words"));

        assertThat(outcome.isCompleted()).isTrue();
        assertThat(seen.get()).isEqualTo("unknown words");
    }

    @Test
    void dispatch_콜백_없는_그룹에서_하위_명령_불일치는_CommandNotFound() {
        registry.register(Command.builder("settings")
            .subcommand(Command.builder("title").callback(ctx -> { }))
            .build());

        DispatchOutcome outcome = dispatcher.dispatch(message("!settings nope"));

        assertThat(((Failed) outcome).error()).isInstanceOf(CommandNotFound.class)
            .hasMessageContaining("settings nope");
    }

    // ========== 취소 ==========

    @Test
    void dispatch_가드_대기중_인터럽트되면_Cancelled_쿨다운_미차감() throws Exception {
        // given
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        AtomicBoolean firstCall = new AtomicBoolean(true);
        Command slow = Command.builder("slow")
            .guard(Guard.named("remote", ctx -> {
                if (firstCall.getAndSet(false)) {
                    entered.countDown();
                    never.await();
                }
                return true;
            }))
            .cooldown(CooldownSpec.fixedWindow(1, Duration.ofMinutes(1), BucketType.DEFAULT))
            .callback(ctx -> { })
            .build();
        registry.register(slow);

        AtomicReference<DispatchOutcome> result = new AtomicReference<>();
        Thread caller = new Thread(() -> result.set(dispatcher.dispatch(message("!slow"))));
        caller.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        caller.interrupt();
        caller.join(5_000);

        // then
        assertThat(result.get()).isInstanceOf(Cancelled.class);
        assertThat(((Cancelled) result.get()).cancelledAt()).isEqualTo(DispatchState.GUARD);
        assertThat(slow.getCooldowns().trackedKeys()).isZero();
        verifyNoInteractions(errorReporter);

        assertThat(dispatcher.dispatch(message("!slow")).isCompleted()).isTrue();
    }

    // ========== 비동기 ==========

    @Test
    void dispatchAsync_워커_스레드에서_실행() throws Exception {
        // given
        AtomicReference<String> threadName = new AtomicReference<>();
        registry.register(Command.builder("ping")
            .callback(ctx -> threadName.set(Thread.currentThread().getName()))
            .build());

        // when
        CompletableFuture<DispatchOutcome> future = dispatcher.dispatchAsync(message("!ping"));
        DispatchOutcome outcome = future.get(5, TimeUnit.SECONDS);

        // then
        assertThat(outcome.isCompleted()).isTrue();
        assertThat(threadName.get()).startsWith("chatcommand-dispatch-");
    }

    @Test
    void dispatchAsync_실패도_정상_완료된_future로_전달() throws Exception {
        DispatchOutcome outcome = dispatcher.dispatchAsync(message("!missing")).get(5, TimeUnit.SECONDS);

        assertThat(outcome.isFailed()).isTrue();
        verify(errorReporter).report(any(CommandContext.class), any(CommandNotFound.class));
        verify(errorReporter, never()).report(any(CommandContext.class), any(CommandInvokeError.class));
    }

    // ========== 입력 검증 ==========

    @Test
    void dispatch_null_메시지는_IllegalArgumentException() {
        assertThatThrownBy(() -> dispatcher.dispatch(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void build_접두사가_없으면_IllegalStateException() {
        assertThatThrownBy(() -> CommandDispatcher.builder(registry).build())
            .isInstanceOf(IllegalStateException.class);
    }
}
