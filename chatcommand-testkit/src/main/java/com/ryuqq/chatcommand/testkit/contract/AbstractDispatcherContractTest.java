package com.ryuqq.chatcommand.testkit.contract;

import com.ryuqq.chatcommand.adapter.inmemory.registry.InMemoryCommandRegistry;
import com.ryuqq.chatcommand.adapter.runner.CommandDispatcher;
import com.ryuqq.chatcommand.adapter.runner.DispatcherConfig;
import com.ryuqq.chatcommand.core.contract.Command;
import com.ryuqq.chatcommand.core.convert.ConverterRegistry;
import com.ryuqq.chatcommand.core.exception.CommandException;
import com.ryuqq.chatcommand.core.model.ChatMessage;
import com.ryuqq.chatcommand.core.model.Chatter;
import com.ryuqq.chatcommand.core.outcome.Completed;
import com.ryuqq.chatcommand.core.outcome.DispatchOutcome;
import com.ryuqq.chatcommand.core.outcome.Failed;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for dispatcher Contract Tests.
 *
 * <p>Wires a {@link CommandDispatcher} to an {@link InMemoryCommandRegistry} with
 * recording collaborators and a manually advanced clock.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>registry: case-sensitive in-memory registry</li>
 *   <li>dispatcher: prefix {@code "!"}</li>
 *   <li>reporter / sender: record every report and reply</li>
 *   <li>clock: starts at {@link ChatMessages#RECEIVED_AT}</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractDispatcherContractTest {
 *     {@literal @}Test
 *     void ping() {
 *         register(Command.builder("ping").callback(ctx -&gt; ctx.send("pong")));
 *
 *         assertCompleted(dispatch("!ping"));
 *         assertEquals(List.of("pong"), sender.texts());
 *     }
 * }
 * </pre>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public abstract class AbstractDispatcherContractTest {

    protected static final String PREFIX = "!";

    protected InMemoryCommandRegistry registry;
    protected ConverterRegistry converters;
    protected RecordingErrorReporter reporter;
    protected RecordingMessageSender sender;
    protected MutableClock clock;
    protected CommandDispatcher dispatcher;

    /**
     * Sets up test fixtures before each test.
     */
    @BeforeEach
    void setUpDispatcher() {
        registry = createRegistry();
        converters = ConverterRegistry.withDefaults();
        reporter = new RecordingErrorReporter();
        sender = new RecordingMessageSender();
        clock = new MutableClock(ChatMessages.RECEIVED_AT);
        dispatcher = configure(CommandDispatcher.builder(registry)
            .prefixes(PREFIX)
            .errorReporter(reporter)
            .messageSender(sender)
            .clock(clock)
            .config(new DispatcherConfig().withConcurrency(4).withShutdownTimeoutMs(2_000)))
            .build();
    }

    /**
     * Stops worker threads after each test.
     */
    @AfterEach
    void tearDownDispatcher() throws InterruptedException {
        if (dispatcher != null) {
            dispatcher.shutdown();
        }
        reporter.clear();
        sender.clear();
    }

    /**
     * Registry factory; override for case-insensitive scenarios.
     */
    protected InMemoryCommandRegistry createRegistry() {
        return new InMemoryCommandRegistry();
    }

    /**
     * Extension point for global guards, hooks or a custom prefix provider.
     */
    protected CommandDispatcher.Builder configure(CommandDispatcher.Builder builder) {
        return builder;
    }

    /**
     * Builds and registers a command.
     */
    protected Command register(Command.Builder builder) {
        Command command = builder.build(converters);
        registry.register(command);
        return command;
    }

    protected DispatchOutcome dispatch(String text) {
        return dispatcher.dispatch(ChatMessages.of(text));
    }

    protected DispatchOutcome dispatch(Chatter chatter, String text) {
        return dispatcher.dispatch(ChatMessages.from(chatter, text));
    }

    protected ChatMessage message(String text) {
        return ChatMessages.of(text);
    }

    /**
     * Moves the clock to {@code RECEIVED_AT + seconds}.
     */
    protected void atSecond(long seconds) {
        clock.set(ChatMessages.RECEIVED_AT.plusSeconds(seconds));
    }

    protected Instant now() {
        return clock.instant();
    }

    /**
     * Asserts a completed outcome.
     *
     * @return the completed outcome
     */
    protected Completed assertCompleted(DispatchOutcome outcome) {
        assertTrue(outcome instanceof Completed,
            String.format("Expected Completed but was %s", outcome));
        return (Completed) outcome;
    }

    /**
     * Asserts a failed outcome carrying the given error type, reported exactly once.
     *
     * @return the reported error
     */
    protected <E extends CommandException> E assertFailedWith(DispatchOutcome outcome, Class<E> errorType) {
        assertTrue(outcome instanceof Failed,
            String.format("Expected Failed(%s) but was %s", errorType.getSimpleName(), outcome));
        CommandException error = ((Failed) outcome).error();
        assertInstanceOf(errorType, error,
            String.format("Expected %s but was %s: %s",
                errorType.getSimpleName(), error.getClass().getSimpleName(), error.getMessage()));
        assertEquals(1, reporter.count(), "Failed invocation must be reported exactly once");
        assertSame(error, reporter.lastError());
        return errorType.cast(error);
    }
}
