package com.ryuqq.chatcommand.adapter.runner;

import com.ryuqq.chatcommand.application.dispatcher.Dispatcher;
import com.ryuqq.chatcommand.core.context.CommandContext;
import com.ryuqq.chatcommand.core.contract.Command;
import com.ryuqq.chatcommand.core.contract.CommandCallback;
import com.ryuqq.chatcommand.core.exception.CommandException;
import com.ryuqq.chatcommand.core.exception.CommandHookError;
import com.ryuqq.chatcommand.core.exception.CommandInvokeError;
import com.ryuqq.chatcommand.core.exception.CommandNotFound;
import com.ryuqq.chatcommand.core.guard.Guard;
import com.ryuqq.chatcommand.core.guard.GuardChain;
import com.ryuqq.chatcommand.core.model.ChatMessage;
import com.ryuqq.chatcommand.core.outcome.Cancelled;
import com.ryuqq.chatcommand.core.outcome.Completed;
import com.ryuqq.chatcommand.core.outcome.DispatchOutcome;
import com.ryuqq.chatcommand.core.outcome.Failed;
import com.ryuqq.chatcommand.core.outcome.Ignored;
import com.ryuqq.chatcommand.core.parse.ArgumentBinder;
import com.ryuqq.chatcommand.core.parse.Tokenizer;
import com.ryuqq.chatcommand.core.spi.CommandRegistry;
import com.ryuqq.chatcommand.core.spi.ErrorReporter;
import com.ryuqq.chatcommand.core.spi.InvocationHook;
import com.ryuqq.chatcommand.core.spi.LoggingErrorReporter;
import com.ryuqq.chatcommand.core.spi.MessageSender;
import com.ryuqq.chatcommand.core.spi.PrefixProvider;
import com.ryuqq.chatcommand.core.spi.noop.NoOpMessageSender;
import com.ryuqq.chatcommand.core.statemachine.DispatchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 기본 {@link Dispatcher} 구현.
 *
 * <p>메시지 한 건을 다음 순서로 처리합니다:</p>
 * <pre>
 * PREFIX_MATCH  접두사 비교 (불일치 → Ignored, 보고 없음)
 *   ↓
 * LOOKUP        명령 이름 조회, 그룹이면 하위 명령 탐색
 *   ↓
 * TOKENIZE      인자 문자열 토큰화
 *   ↓
 * BIND          파라미터 바인딩 + 변환
 *   ↓
 * GUARD         전역 Guard → 명령 Guard 체인
 *   ↓
 * COOLDOWN      모든 cooldown 평가 후 일괄 커밋
 *   ↓
 * INVOKE        before 훅 → 본문 → after 훅
 *   ↓
 * COMPLETED
 * </pre>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>{@link CommandException} → FAILED, 명령 범위 보고기(명령 → 그룹 → 컴포넌트) 후 전역 ErrorReporter 각 1회 호출</li>
 *   <li>본문 예외 → {@link CommandInvokeError}, 훅 예외 → {@link CommandHookError}</li>
 *   <li>{@link InterruptedException} 또는 단계 경계에서 관찰된 인터럽트 → CANCELLED (보고 없음)</li>
 *   <li>그 외 RuntimeException → ERROR 로그 후 {@link CommandInvokeError}로 FAILED</li>
 *   <li>ErrorReporter가 던진 예외 → WARN 로그, 전파하지 않음</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>{@link #dispatch(ChatMessage)}: 호출자 스레드에서 실행</li>
 *   <li>{@link #dispatchAsync(ChatMessage)}: 고정 크기 스레드 풀(concurrency)에서 실행</li>
 *   <li>호출끼리는 독립적이며, cooldown 상태만 명령 단위 lock으로 보호됨</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CommandDispatcher dispatcher = CommandDispatcher.builder(registry)
 *     .prefixes("!", "?")
 *     .messageSender(chatClient)
 *     .errorReporter((ctx, error) -&gt; ctx.send(error.getMessage()))
 *     .guard(Guard.named("not-banned", ctx -&gt; !banList.contains(ctx.chatter().id())))
 *     .build();
 *
 * dispatcher.dispatchAsync(message);
 * ...
 * dispatcher.shutdown();
 * </pre>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class CommandDispatcher implements Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final CommandRegistry registry;
    private final PrefixProvider prefixProvider;
    private final ErrorReporter errorReporter;
    private final MessageSender messageSender;
    private final Clock clock;
    private final GuardChain globalGuards;
    private final List<InvocationHook> globalHooks;
    private final DispatcherConfig config;
    private final ExecutorService workerExecutor;

    private CommandDispatcher(Builder builder) {
        this.registry = builder.registry;
        this.prefixProvider = builder.prefixProvider;
        this.errorReporter = builder.errorReporter;
        this.messageSender = builder.messageSender;
        this.clock = builder.clock;
        this.globalGuards = GuardChain.of(builder.guards);
        this.globalHooks = List.copyOf(builder.hooks);
        this.config = builder.config;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency(), new DispatchThreadFactory());
    }

    /**
     * Builder 생성.
     *
     * @param registry 명령 레지스트리
     * @return Builder
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public static Builder builder(CommandRegistry registry) {
        return new Builder(registry);
    }

    @Override
    public DispatchOutcome dispatch(ChatMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }

        String prefix = matchPrefix(message);
        if (prefix == null) {
            return new Ignored(message);
        }

        CommandContext context = new CommandContext(message, prefix, messageSender);
        return process(context);
    }

    @Override
    public CompletableFuture<DispatchOutcome> dispatchAsync(ChatMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }

        CompletableFuture<DispatchOutcome> result = new CompletableFuture<>();
        Future<?> task = workerExecutor.submit(() -> {
            if (result.isDone()) {
                return;
            }
            try {
                result.complete(dispatch(message));
            } catch (RuntimeException e) {
                log.error("Dispatch task failed for message {}", message.id(), e);
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((outcome, error) -> {
            if (result.isCancelled()) {
                task.cancel(true);
            }
        });
        return result;
    }

    /**
     * Dispatcher 종료 (리소스 정리).
     *
     * <p>새 비동기 dispatch를 거부하고, 진행 중인 작업을 shutdownTimeoutMs까지 기다린 뒤
     * 남은 작업은 인터럽트합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("Dispatch workers did not finish within {}ms, interrupting", config.shutdownTimeoutMs());
            workerExecutor.shutdownNow();
        }
    }

    public DispatcherConfig getConfig() {
        return config;
    }

    public CommandRegistry getRegistry() {
        return registry;
    }

    /**
     * 접두사 비교.
     *
     * @return 처음 일치한 접두사, 없으면 null
     */
    private String matchPrefix(ChatMessage message) {
        List<String> prefixes;
        try {
            prefixes = prefixProvider.prefixes(message);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Prefix resolution interrupted for message {}", message.id());
            return null;
        } catch (Exception e) {
            log.warn("Prefix provider failed for message {}: {}", message.id(), e.getMessage(), e);
            return null;
        }
        if (prefixes == null) {
            return null;
        }
        for (String prefix : prefixes) {
            if (prefix != null && !prefix.isEmpty() && message.text().startsWith(prefix)) {
                return prefix;
            }
        }
        return null;
    }

    private DispatchOutcome process(CommandContext context) {
        try {
            context.transitionTo(DispatchState.LOOKUP);
            Command command = lookup(context);

            context.transitionTo(DispatchState.TOKENIZE);
            context.attachTokens(Tokenizer.tokenize(context.getArgumentText(), command.getDeclaredParameters()));

            context.transitionTo(DispatchState.BIND);
            context.attachArguments(ArgumentBinder.bind(
                context,
                command.getParameters(),
                context.getTokens(),
                command.getQualifiedName(),
                command.isIgnoreExtraArguments()
            ));
            checkInterrupted();

            context.transitionTo(DispatchState.GUARD);
            globalGuards.check(context);
            command.getGuards().check(context);
            checkInterrupted();

            context.transitionTo(DispatchState.COOLDOWN);
            command.getCooldowns().acquire(context, clock.instant());

            context.transitionTo(DispatchState.INVOKE);
            invoke(context, command);

            context.transitionTo(DispatchState.COMPLETED);
            log.debug("Command {} completed", command.getQualifiedName());
            return new Completed(context);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            DispatchState cancelledAt = context.getState();
            context.transitionTo(DispatchState.CANCELLED);
            log.debug("Dispatch of {} cancelled at {}", context.getInvokedWith(), cancelledAt);
            return new Cancelled(context, cancelledAt);
        } catch (CommandException e) {
            return fail(context, e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure while dispatching {}", context, e);
            return fail(context, new CommandInvokeError("Unexpected failure while dispatching command: " + e.getMessage(), e));
        }
    }

    /**
     * 명령 조회 (그룹이면 하위 명령까지).
     *
     * @throws CommandNotFound 명령이 없거나, 본문 없는 그룹에서 하위 명령이 일치하지 않는 경우
     */
    private Command lookup(CommandContext context) {
        String afterPrefix = stripLeading(context.getMessage().text().substring(context.getPrefix().length()));
        String invokedWith = firstWord(afterPrefix);
        context.recordInvokedWith(invokedWith);

        Optional<Command> resolved = invokedWith.isEmpty() ? Optional.empty() : registry.resolve(invokedWith);
        if (resolved.isEmpty()) {
            throw new CommandNotFound(invokedWith);
        }

        Command command = resolved.get();
        String trigger = null;
        String remainder = afterPrefix.substring(invokedWith.length());
        String unmatched = null;

        while (command.isGroup()) {
            String candidateText = stripLeading(remainder);
            if (candidateText.isEmpty()) {
                break;
            }
            String candidate = firstWord(candidateText);
            Optional<Command> subcommand = command.findSubcommand(candidate, registry.isCaseInsensitive());
            if (subcommand.isEmpty()) {
                unmatched = candidate;
                break;
            }
            command = subcommand.get();
            trigger = candidate;
            remainder = candidateText.substring(candidate.length());
        }

        if (!command.hasCallback()) {
            throw new CommandNotFound(unmatched == null
                ? command.getQualifiedName()
                : command.getQualifiedName() + " " + unmatched);
        }

        context.resolveCommand(invokedWith, command, trigger, remainder);
        log.debug("Resolved {} to command {}", invokedWith, command.getQualifiedName());
        return command;
    }

    private void invoke(CommandContext context, Command command) throws InterruptedException {
        List<InvocationHook> hooks = new ArrayList<>(globalHooks.size() + command.getHooks().size());
        hooks.addAll(globalHooks);
        hooks.addAll(command.getHooks());

        for (InvocationHook hook : hooks) {
            try {
                hook.before(context);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                throw new CommandHookError("Before-invoke hook failed: " + e.getMessage(), e);
            }
        }

        CommandCallback callback = command.getCallback()
            .orElseThrow(() -> new CommandNotFound(command.getQualifiedName()));
        try {
            callback.invoke(context);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            throw new CommandInvokeError(
                "Command \"" + command.getQualifiedName() + "\" raised an exception: "
                    + e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }

        for (InvocationHook hook : hooks) {
            try {
                hook.after(context);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                throw new CommandHookError("After-invoke hook failed: " + e.getMessage(), e);
            }
        }
    }

    private DispatchOutcome fail(CommandContext context, CommandException error) {
        DispatchState failedAt = context.getState();
        context.transitionTo(DispatchState.FAILED);
        log.debug("Dispatch of {} failed at {}: {}", context.getInvokedWith(), failedAt, error.getMessage());
        Command command = context.getCommand();
        if (command != null) {
            for (ErrorReporter reporter : command.getErrorReporters()) {
                report(reporter, context, error);
            }
        }
        report(errorReporter, context, error);
        return new Failed(context, error, failedAt);
    }

    private static void report(ErrorReporter reporter, CommandContext context, CommandException error) {
        try {
            reporter.report(context, error);
        } catch (RuntimeException e) {
            log.warn("Error reporter failed while reporting {}: {}", error.getClass().getSimpleName(), e.getMessage(), e);
        }
    }

    private static void checkInterrupted() throws InterruptedException {
        if (Thread.interrupted()) {
            throw new InterruptedException("Dispatch interrupted");
        }
    }

    private static String stripLeading(String text) {
        int i = 0;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return text.substring(i);
    }

    private static String firstWord(String text) {
        int i = 0;
        while (i < text.length() && !Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return text.substring(0, i);
    }

    /**
     * 이름이 붙은 데몬 작업 스레드 생성.
     */
    private static final class DispatchThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "chatcommand-dispatch-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    /**
     * CommandDispatcher Builder.
     */
    public static final class Builder {

        private final CommandRegistry registry;
        private PrefixProvider prefixProvider;
        private ErrorReporter errorReporter = new LoggingErrorReporter();
        private MessageSender messageSender = new NoOpMessageSender();
        private Clock clock = Clock.systemUTC();
        private final List<Guard> guards = new ArrayList<>();
        private final List<InvocationHook> hooks = new ArrayList<>();
        private DispatcherConfig config = new DispatcherConfig();

        private Builder(CommandRegistry registry) {
            if (registry == null) {
                throw new IllegalArgumentException("registry cannot be null");
            }
            this.registry = registry;
        }

        public Builder prefixes(String... prefixes) {
            this.prefixProvider = PrefixProvider.of(prefixes);
            return this;
        }

        public Builder prefixProvider(PrefixProvider prefixProvider) {
            if (prefixProvider == null) {
                throw new IllegalArgumentException("prefixProvider cannot be null");
            }
            this.prefixProvider = prefixProvider;
            return this;
        }

        public Builder errorReporter(ErrorReporter errorReporter) {
            if (errorReporter == null) {
                throw new IllegalArgumentException("errorReporter cannot be null");
            }
            this.errorReporter = errorReporter;
            return this;
        }

        public Builder messageSender(MessageSender messageSender) {
            if (messageSender == null) {
                throw new IllegalArgumentException("messageSender cannot be null");
            }
            this.messageSender = messageSender;
            return this;
        }

        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new IllegalArgumentException("clock cannot be null");
            }
            this.clock = clock;
            return this;
        }

        /**
         * 모든 명령 앞에 평가되는 전역 Guard 추가.
         */
        public Builder guard(Guard guard) {
            if (guard == null) {
                throw new IllegalArgumentException("guard cannot be null");
            }
            guards.add(guard);
            return this;
        }

        /**
         * 모든 명령에 적용되는 전역 훅 추가 (명령 훅보다 먼저 실행).
         */
        public Builder hook(InvocationHook hook) {
            if (hook == null) {
                throw new IllegalArgumentException("hook cannot be null");
            }
            hooks.add(hook);
            return this;
        }

        public Builder config(DispatcherConfig config) {
            if (config == null) {
                throw new IllegalArgumentException("config cannot be null");
            }
            this.config = config;
            return this;
        }

        /**
         * @return CommandDispatcher
         * @throws IllegalStateException 접두사가 설정되지 않은 경우
         */
        public CommandDispatcher build() {
            if (prefixProvider == null) {
                throw new IllegalStateException("prefixes or prefixProvider must be set");
            }
            return new CommandDispatcher(this);
        }
    }
}
