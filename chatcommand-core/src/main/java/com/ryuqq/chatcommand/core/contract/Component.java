package com.ryuqq.chatcommand.core.contract;

import com.ryuqq.chatcommand.core.convert.ConverterRegistry;
import com.ryuqq.chatcommand.core.guard.Guard;
import com.ryuqq.chatcommand.core.guard.GuardChain;
import com.ryuqq.chatcommand.core.spi.ErrorReporter;
import com.ryuqq.chatcommand.core.spi.InvocationHook;

import java.util.ArrayList;
import java.util.List;

/**
 * 공통 Guard와 훅을 공유하는 명령 묶음.
 *
 * <p>레지스트리에 원자적으로 추가/제거됩니다. 컴포넌트 Guard와 훅은
 * 빌드 시점에 소속 명령(하위 명령 포함) 앞에 붙습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Component moderation = Component.builder("moderation")
 *     .guard(Guards.isModerator())
 *     .command(Command.builder("timeout").positional("user", ArgumentType.of(String.class)).callback(...))
 *     .command(Command.builder("clear").callback(...))
 *     .build(converters);
 * registry.addComponent(moderation);
 * </pre>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class Component {

    private final String name;
    private final GuardChain guards;
    private final List<Command> commands;

    private Component(String name, GuardChain guards, List<Command> commands) {
        this.name = name;
        this.guards = guards;
        this.commands = List.copyOf(commands);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    /**
     * 컴포넌트 수준 Guard (소속 명령의 체인에 이미 포함됨).
     */
    public GuardChain getGuards() {
        return guards;
    }

    public List<Command> getCommands() {
        return commands;
    }

    @Override
    public String toString() {
        return "Component{" + name + ", commands=" + commands.size() + '}';
    }

    /**
     * Component Builder.
     */
    public static final class Builder {

        private final String name;
        private final List<Guard> guards = new ArrayList<>();
        private final List<InvocationHook> hooks = new ArrayList<>();
        private final List<ErrorReporter> errorReporters = new ArrayList<>();
        private final List<Command.Builder> commands = new ArrayList<>();

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            this.name = name;
        }

        public Builder guard(Guard guard) {
            if (guard == null) {
                throw new IllegalArgumentException("guard cannot be null");
            }
            guards.add(guard);
            return this;
        }

        public Builder hook(InvocationHook hook) {
            if (hook == null) {
                throw new IllegalArgumentException("hook cannot be null");
            }
            hooks.add(hook);
            return this;
        }

        /**
         * 소속 명령이 실패했을 때 명령 보고기 다음, 전역 보고기 전에 호출됩니다.
         */
        public Builder errorReporter(ErrorReporter errorReporter) {
            if (errorReporter == null) {
                throw new IllegalArgumentException("errorReporter cannot be null");
            }
            errorReporters.add(errorReporter);
            return this;
        }

        public Builder command(Command.Builder command) {
            if (command == null) {
                throw new IllegalArgumentException("command cannot be null");
            }
            commands.add(command);
            return this;
        }

        /**
         * 컴포넌트와 소속 명령 전체를 빌드.
         *
         * @param converters 변환기 레지스트리
         * @return Component
         */
        public Component build(ConverterRegistry converters) {
            GuardChain chain = GuardChain.of(guards);
            Command.Inheritance inheritance = new Command.Inheritance(
                name, null, chain, List.copyOf(hooks), List.copyOf(errorReporters));
            List<Command> built = new ArrayList<>(commands.size());
            for (Command.Builder command : commands) {
                built.add(command.build(converters, inheritance));
            }
            return new Component(name, chain, built);
        }
    }
}
