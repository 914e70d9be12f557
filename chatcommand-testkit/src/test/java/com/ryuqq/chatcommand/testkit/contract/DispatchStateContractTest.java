package com.ryuqq.chatcommand.testkit.contract;

import com.ryuqq.chatcommand.adapter.runner.CommandDispatcher;
import com.ryuqq.chatcommand.core.context.CommandContext;
import com.ryuqq.chatcommand.core.contract.Command;
import com.ryuqq.chatcommand.core.convert.ArgumentType;
import com.ryuqq.chatcommand.core.exception.CommandNotFound;
import com.ryuqq.chatcommand.core.outcome.DispatchOutcome;
import com.ryuqq.chatcommand.core.outcome.Failed;
import com.ryuqq.chatcommand.core.outcome.Ignored;
import com.ryuqq.chatcommand.core.statemachine.DispatchState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: dispatch state machine and outcomes.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Messages without a prefix are ignored silently</li>
 *   <li>Every failure ends in FAILED and is reported exactly once</li>
 *   <li>Groups resolve subcommands and fall back to their own callback</li>
 *   <li>A throwing reporter never escapes the dispatcher</li>
 * </ul>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
class DispatchStateContractTest extends AbstractDispatcherContractTest {

    @Test
    void testNoPrefix_Ignored_NotReported() {
        // When
        DispatchOutcome outcome = dispatch("just chatting");

        // Then
        assertInstanceOf(Ignored.class, outcome);
        assertEquals("just chatting", ((Ignored) outcome).message().text());
        assertEquals(0, reporter.count());
    }

    @Test
    void testCompleted_ContextReachesCompletedState() {
        register(Command.builder("ping").callback(ctx -> ctx.send("pong")));

        CommandContext context = assertCompleted(dispatch("!ping")).context();

        assertEquals(DispatchState.COMPLETED, context.getState());
        assertEquals("ping", context.getInvokedWith());
        assertEquals(List.of("pong"), sender.texts());
    }

    @Test
    void testUnknownCommand_FailedAtLookup_ReportedOnce() {
        // When
        DispatchOutcome outcome = dispatch("!nothing here");

        // Then
        CommandNotFound error = assertFailedWith(outcome, CommandNotFound.class);
        assertEquals("nothing", error.getInvokedWith());
        assertEquals(DispatchState.LOOKUP, ((Failed) outcome).failedAt());
        assertEquals(DispatchState.FAILED, ((Failed) outcome).context().getState());
    }

    @Test
    void testPrefixOnly_CommandNotFoundWithEmptyName() {
        CommandNotFound error = assertFailedWith(dispatch("!"), CommandNotFound.class);

        assertEquals("", error.getInvokedWith());
    }

    @Test
    void testWhitespaceAfterPrefix_StillResolves() {
        register(Command.builder("ping").callback(ctx -> { }));

        assertCompleted(dispatch("!   ping"));
    }

    @Test
    void testGroup_SubcommandResolved_RestBound() {
        // Given
        register(Command.builder("settings")
            .subcommand(Command.builder("title")
                .aliases("t")
                .consumeRest("value", ArgumentType.of(String.class))
                .callback(ctx -> ctx.send("title=" + ctx.argument("value", String.class)))));

        // When
        CommandContext context = assertCompleted(dispatch("!settings t Friday  Night")).context();

        // Then
        assertEquals("settings title", context.getCommand().getQualifiedName());
        assertEquals("t", context.getSubcommandTrigger());
        assertEquals(List.of("title=Friday  Night"), sender.texts());
    }

    @Test
    void testGroup_NoMatchingSubcommand_GroupCallbackRuns() {
        AtomicInteger groupRuns = new AtomicInteger();
        register(Command.builder("settings")
            .subcommand(Command.builder("title").callback(ctx -> { }))
            .callback(ctx -> groupRuns.incrementAndGet()));

        assertCompleted(dispatch("!settings"));
        assertCompleted(dispatch("!settings unknown"));

        assertEquals(2, groupRuns.get());
    }

    @Test
    void testGroupWithoutCallback_NoSubcommand_CommandNotFound() {
        register(Command.builder("settings")
            .subcommand(Command.builder("title").callback(ctx -> { })));

        CommandNotFound error = assertFailedWith(dispatch("!settings"), CommandNotFound.class);

        assertEquals("settings", error.getInvokedWith());
    }

    @Test
    void testThrowingReporter_DoesNotEscape() throws InterruptedException {
        // Given
        CommandDispatcher throwing = CommandDispatcher.builder(registry)
            .prefixes(PREFIX)
            .errorReporter((ctx, error) -> {
                throw new IllegalStateException("chat connection lost");
            })
            .build();

        // When
        DispatchOutcome outcome = throwing.dispatch(message("!missing"));
        throwing.shutdown();

        // Then
        assertTrue(outcome.isFailed());
    }
}
