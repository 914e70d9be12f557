package com.ryuqq.chatcommand.adapter.inmemory.registry;

import com.ryuqq.chatcommand.core.contract.Command;
import com.ryuqq.chatcommand.core.contract.Component;
import com.ryuqq.chatcommand.core.exception.CommandExistsError;
import com.ryuqq.chatcommand.core.spi.CommandRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of {@link CommandRegistry}.
 *
 * <p>Lookups read an immutable {@link Snapshot} through a volatile reference and never lock.
 * Every mutation copies the current snapshot, applies the change to the copy and publishes it
 * with a single volatile write (copy-on-write), so readers always observe either the state
 * before or the state after a mutation, never a partially registered command.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>Writers are serialized by a {@link ReentrantLock}</li>
 *   <li>Readers are lock-free</li>
 *   <li>A failed mutation (e.g. {@link CommandExistsError}) publishes nothing</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * CommandRegistry registry = new InMemoryCommandRegistry(true);
 * registry.register(Command.builder("ping").callback(ctx -&gt; ctx.send("pong")).build());
 *
 * registry.resolve("PING"); // Optional[Command{ping}] (case-insensitive)
 * </pre>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public class InMemoryCommandRegistry implements CommandRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCommandRegistry.class);

    private final boolean caseInsensitive;
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    /**
     * Creates a case-sensitive registry.
     */
    public InMemoryCommandRegistry() {
        this(false);
    }

    /**
     * @param caseInsensitive whether names and aliases are matched ignoring case
     */
    public InMemoryCommandRegistry(boolean caseInsensitive) {
        this.caseInsensitive = caseInsensitive;
    }

    @Override
    public void register(Command command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        writeLock.lock();
        try {
            Snapshot next = snapshot.mutable();
            next.add(command, this::normalize);
            snapshot = next.freeze();
            log.info("Registered command {} (aliases: {})", command.getName(), command.getAliases());
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<Command> unregister(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        writeLock.lock();
        try {
            Command existing = snapshot.index.get(normalize(name));
            if (existing == null) {
                return Optional.empty();
            }
            Snapshot next = snapshot.mutable();
            next.remove(existing, this::normalize);
            snapshot = next.freeze();
            log.info("Unregistered command {}", existing.getName());
            return Optional.of(existing);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void addComponent(Component component) {
        if (component == null) {
            throw new IllegalArgumentException("component cannot be null");
        }
        writeLock.lock();
        try {
            if (snapshot.components.containsKey(component.getName())) {
                throw new IllegalArgumentException("Component \"" + component.getName() + "\" is already added");
            }
            Snapshot next = snapshot.mutable();
            for (Command command : component.getCommands()) {
                next.add(command, this::normalize);
            }
            next.components.put(component.getName(), component);
            snapshot = next.freeze();
            log.info("Added component {} with {} commands", component.getName(), component.getCommands().size());
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<Component> removeComponent(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        writeLock.lock();
        try {
            Component component = snapshot.components.get(name);
            if (component == null) {
                return Optional.empty();
            }
            Snapshot next = snapshot.mutable();
            for (Command command : component.getCommands()) {
                if (next.commands.contains(command)) {
                    next.remove(command, this::normalize);
                }
            }
            next.components.remove(name);
            snapshot = next.freeze();
            log.info("Removed component {}", name);
            return Optional.of(component);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<Command> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshot.index.get(normalize(name)));
    }

    @Override
    public Collection<Command> commands() {
        return snapshot.commands;
    }

    /**
     * Components currently added, in insertion order.
     *
     * @return immutable view
     */
    public Collection<Component> components() {
        return snapshot.components.values();
    }

    @Override
    public boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    private String normalize(String name) {
        return caseInsensitive ? name.toLowerCase(Locale.ROOT) : name;
    }

    /**
     * Name index, registration-ordered command list and component table.
     *
     * <p>Published instances are wrapped in unmodifiable views; {@link #mutable()} returns a
     * private working copy used only under the write lock.</p>
     */
    private static final class Snapshot {

        static final Snapshot EMPTY = new Snapshot(new LinkedHashMap<>(), new ArrayList<>(), new LinkedHashMap<>()).freeze();

        final Map<String, Command> index;
        final List<Command> commands;
        final Map<String, Component> components;

        private Snapshot(Map<String, Command> index, List<Command> commands, Map<String, Component> components) {
            this.index = index;
            this.commands = commands;
            this.components = components;
        }

        Snapshot mutable() {
            return new Snapshot(new LinkedHashMap<>(index), new ArrayList<>(commands), new LinkedHashMap<>(components));
        }

        Snapshot freeze() {
            return new Snapshot(
                Collections.unmodifiableMap(index),
                Collections.unmodifiableList(commands),
                Collections.unmodifiableMap(components)
            );
        }

        void add(Command command, UnaryOperator<String> normalizer) {
            for (String name : command.names()) {
                Command existing = index.get(normalizer.apply(name));
                if (existing != null) {
                    throw new CommandExistsError(name, existing.getName());
                }
            }
            for (String name : command.names()) {
                Command clash = index.putIfAbsent(normalizer.apply(name), command);
                if (clash != null) {
                    // aliases of the same command differing only in case
                    throw new CommandExistsError(name, clash.getName());
                }
            }
            commands.add(command);
        }

        void remove(Command command, UnaryOperator<String> normalizer) {
            for (String name : command.names()) {
                index.remove(normalizer.apply(name), command);
            }
            commands.remove(command);
        }
    }
}
