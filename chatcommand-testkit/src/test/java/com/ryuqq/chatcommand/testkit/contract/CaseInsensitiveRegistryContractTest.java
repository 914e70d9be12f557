package com.ryuqq.chatcommand.testkit.contract;

import com.ryuqq.chatcommand.adapter.inmemory.registry.InMemoryCommandRegistry;
import com.ryuqq.chatcommand.core.contract.Command;
import com.ryuqq.chatcommand.core.exception.CommandExistsError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: lookup against a case-insensitive registry.
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
class CaseInsensitiveRegistryContractTest extends AbstractDispatcherContractTest {

    @Override
    protected InMemoryCommandRegistry createRegistry() {
        return new InMemoryCommandRegistry(true);
    }

    @Test
    void testCaseInsensitive_CommandAndSubcommandMatchAnyCase() {
        // Given
        register(Command.builder("settings")
            .subcommand(Command.builder("title").callback(ctx -> ctx.send("title set"))));

        // When
        assertCompleted(dispatch("!SETTINGS Title"));

        // Then
        assertEquals("title set", sender.texts().get(0));
    }

    @Test
    void testCaseInsensitive_AliasDifferingInCase_Rejected() {
        register(Command.builder("ping").callback(ctx -> { }));

        assertThrows(CommandExistsError.class,
            () -> register(Command.builder("other").aliases("PING").callback(ctx -> { })));
    }
}
