package com.ryuqq.chatcommand.core.contract;

import com.ryuqq.chatcommand.core.convert.ArgumentType;
import com.ryuqq.chatcommand.core.convert.ConverterRegistry;
import com.ryuqq.chatcommand.core.cooldown.CooldownManager;
import com.ryuqq.chatcommand.core.cooldown.CooldownManagerConfig;
import com.ryuqq.chatcommand.core.cooldown.CooldownSpec;
import com.ryuqq.chatcommand.core.exception.CommandExistsError;
import com.ryuqq.chatcommand.core.guard.Guard;
import com.ryuqq.chatcommand.core.guard.GuardChain;
import com.ryuqq.chatcommand.core.model.Parameter;
import com.ryuqq.chatcommand.core.model.ParameterKind;
import com.ryuqq.chatcommand.core.parse.ParameterBinding;
import com.ryuqq.chatcommand.core.spi.ErrorReporter;
import com.ryuqq.chatcommand.core.spi.InvocationHook;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 등록 가능한 채팅 명령 (불변).
 *
 * <p>{@link #builder(String)}로 선언하고 {@link Builder#build(ConverterRegistry)}로 확정합니다.
 * 빌드 시점에 파라미터 변환기가 확정되고, Guard/훅 목록이 (컴포넌트 → 상위 그룹 → 명령) 순으로 이어 붙습니다.</p>
 *
 * <p>하위 명령을 가진 명령은 그룹입니다. 그룹은 인자 문자열의 첫 단어로 하위 명령을 찾고,
 * 일치하지 않으면 자신의 본문을 실행합니다 (본문이 없으면 CommandNotFound).</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Command greet = Command.builder("greet")
 *     .aliases("hi", "hello")
 *     .description("Greets someone")
 *     .positional("target", ArgumentType.of(String.class))
 *     .guard(Guards.isModerator())
 *     .cooldown(CooldownSpec.gcra(1, Duration.ofSeconds(10), BucketType.CHATTER))
 *     .callback(ctx -&gt; ctx.send("Hello " + ctx.argument("target", String.class)))
 *     .build(ConverterRegistry.withDefaults());
 * </pre>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class Command {

    private final String name;
    private final List<String> aliases;
    private final String qualifiedName;
    private final String parentName;
    private final String componentName;
    private final String description;
    private final Map<String, Object> extras;
    private final List<ParameterBinding> parameters;
    private final GuardChain guards;
    private final List<InvocationHook> hooks;
    private final List<ErrorReporter> errorReporters;
    private final CooldownManager cooldowns;
    private final CommandCallback callback;
    private final List<Command> subcommands;
    private final boolean ignoreExtraArguments;

    private Command(Builder builder, Inheritance inheritance, List<ParameterBinding> parameters,
                    GuardChain guards, List<InvocationHook> hooks, List<ErrorReporter> errorReporters,
                    List<Command> subcommands) {
        this.name = builder.name;
        this.aliases = List.copyOf(builder.aliases);
        this.parentName = inheritance.parentName();
        this.qualifiedName = parentName == null ? name : parentName + " " + name;
        this.componentName = inheritance.componentName();
        this.description = builder.description;
        this.extras = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extras));
        this.parameters = List.copyOf(parameters);
        this.guards = guards;
        this.hooks = List.copyOf(hooks);
        this.errorReporters = List.copyOf(errorReporters);
        this.cooldowns = new CooldownManager(qualifiedName, builder.cooldowns, builder.cooldownConfig);
        this.callback = builder.callback;
        this.subcommands = List.copyOf(subcommands);
        this.ignoreExtraArguments = builder.ignoreExtraArguments;
    }

    /**
     * 명령 선언 시작.
     *
     * @param name 명령 이름 (공백 불가)
     * @return Builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * 이름 또는 별칭으로 하위 명령 조회 (선언 순서상 첫 번째 일치).
     *
     * @param token 호출 토큰
     * @param ignoreCase 대소문자 무시 여부
     * @return 하위 명령 (없으면 empty)
     */
    public Optional<Command> findSubcommand(String token, boolean ignoreCase) {
        for (Command subcommand : subcommands) {
            for (String candidate : subcommand.names()) {
                if (ignoreCase ? candidate.equalsIgnoreCase(token) : candidate.equals(token)) {
                    return Optional.of(subcommand);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * 이름과 별칭 (이름 먼저).
     *
     * @return 호출 가능한 모든 이름
     */
    public List<String> names() {
        List<String> names = new ArrayList<>(aliases.size() + 1);
        names.add(name);
        names.addAll(aliases);
        return names;
    }

    public String getName() {
        return name;
    }

    public List<String> getAliases() {
        return aliases;
    }

    /**
     * 상위 그룹 이름을 포함한 전체 이름 (예: {@code "settings title"}).
     */
    public String getQualifiedName() {
        return qualifiedName;
    }

    public Optional<String> getParentName() {
        return Optional.ofNullable(parentName);
    }

    public Optional<String> getComponentName() {
        return Optional.ofNullable(componentName);
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Object> getExtras() {
        return extras;
    }

    public List<ParameterBinding> getParameters() {
        return parameters;
    }

    public List<Parameter> getDeclaredParameters() {
        return parameters.stream().map(ParameterBinding::parameter).toList();
    }

    /**
     * 컴포넌트/상위 그룹 Guard를 포함한 평가 순서의 Guard 체인.
     */
    public GuardChain getGuards() {
        return guards;
    }

    /**
     * 컴포넌트/상위 그룹 훅을 포함한 실행 순서의 훅 목록.
     */
    public List<InvocationHook> getHooks() {
        return hooks;
    }

    /**
     * 명령 범위 오류 보고기 (명령 → 상위 그룹 → 컴포넌트 순서).
     *
     * <p>Dispatcher는 이 목록을 먼저 호출한 뒤 전역 보고기를 호출합니다.</p>
     */
    public List<ErrorReporter> getErrorReporters() {
        return errorReporters;
    }

    public CooldownManager getCooldowns() {
        return cooldowns;
    }

    public boolean hasCallback() {
        return callback != null;
    }

    public Optional<CommandCallback> getCallback() {
        return Optional.ofNullable(callback);
    }

    public boolean isGroup() {
        return !subcommands.isEmpty();
    }

    public List<Command> getSubcommands() {
        return subcommands;
    }

    public boolean isIgnoreExtraArguments() {
        return ignoreExtraArguments;
    }

    @Override
    public String toString() {
        return "Command{" + qualifiedName + (aliases.isEmpty() ? "" : ", aliases=" + aliases) + '}';
    }

    /**
     * 상위(컴포넌트, 그룹)로부터 물려받는 값.
     */
    record Inheritance(String componentName, String parentName, GuardChain guards, List<InvocationHook> hooks,
                       List<ErrorReporter> errorReporters) {

        static final Inheritance ROOT = new Inheritance(null, null, GuardChain.empty(), List.of(), List.of());
    }

    /**
     * Command Builder.
     */
    public static final class Builder {

        private final String name;
        private final List<String> aliases = new ArrayList<>();
        private String description = "";
        private final Map<String, Object> extras = new LinkedHashMap<>();
        private final List<Parameter> parameters = new ArrayList<>();
        private final Set<String> inheritsDelimiter = new HashSet<>();
        private char delimiter = Parameter.DEFAULT_DELIMITER;
        private final List<Guard> guards = new ArrayList<>();
        private final List<InvocationHook> hooks = new ArrayList<>();
        private final List<ErrorReporter> errorReporters = new ArrayList<>();
        private final List<CooldownSpec> cooldowns = new ArrayList<>();
        private CooldownManagerConfig cooldownConfig = CooldownManagerConfig.defaultConfig();
        private final List<Builder> subcommands = new ArrayList<>();
        private CommandCallback callback;
        private boolean ignoreExtraArguments = true;

        private Builder(String name) {
            validateName(name, "name");
            this.name = name;
        }

        public Builder aliases(String... aliases) {
            if (aliases == null) {
                throw new IllegalArgumentException("aliases cannot be null");
            }
            for (String alias : aliases) {
                validateName(alias, "alias");
                if (alias.equals(name) || this.aliases.contains(alias)) {
                    throw new IllegalArgumentException("Duplicate alias \"" + alias + "\" for command \"" + name + "\"");
                }
                this.aliases.add(alias);
            }
            return this;
        }

        public Builder description(String description) {
            this.description = description == null ? "" : description;
            return this;
        }

        public Builder extra(String key, Object value) {
            if (key == null) {
                throw new IllegalArgumentException("extra key cannot be null");
            }
            this.extras.put(key, value);
            return this;
        }

        public Builder extras(Map<String, ?> extras) {
            if (extras == null) {
                throw new IllegalArgumentException("extras cannot be null");
            }
            extras.forEach(this::extra);
            return this;
        }

        /**
         * delimiter를 지정하지 않은 special 파라미터의 기본 delimiter.
         *
         * @param delimiter 공백/따옴표가 아닌 문자
         * @return this
         */
        public Builder delimiter(char delimiter) {
            if (Character.isWhitespace(delimiter) || delimiter == '"') {
                throw new IllegalArgumentException("delimiter must be a single non-whitespace, non-quote character");
            }
            this.delimiter = delimiter;
            return this;
        }

        public Builder parameter(Parameter parameter) {
            if (parameter == null) {
                throw new IllegalArgumentException("parameter cannot be null");
            }
            parameters.add(parameter);
            return this;
        }

        public Builder positional(String name, ArgumentType type) {
            return parameter(Parameter.positional(name, type));
        }

        public Builder positional(String name, ArgumentType type, Object defaultValue) {
            return parameter(Parameter.positional(name, type).withDefault(defaultValue));
        }

        /**
         * 명령 기본 delimiter를 쓰는 special 파라미터.
         */
        public Builder special(String name, ArgumentType type) {
            parameter(Parameter.special(name, type));
            inheritsDelimiter.add(name);
            return this;
        }

        public Builder special(String name, ArgumentType type, char delimiter) {
            return parameter(Parameter.special(name, type, delimiter));
        }

        public Builder consumeRest(String name, ArgumentType type) {
            return parameter(Parameter.consumeRest(name, type));
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
         * 이 명령(하위 명령 포함)에서 실패한 호출의 오류 보고기 추가.
         */
        public Builder errorReporter(ErrorReporter errorReporter) {
            if (errorReporter == null) {
                throw new IllegalArgumentException("errorReporter cannot be null");
            }
            errorReporters.add(errorReporter);
            return this;
        }

        public Builder cooldown(CooldownSpec cooldown) {
            if (cooldown == null) {
                throw new IllegalArgumentException("cooldown cannot be null");
            }
            cooldowns.add(cooldown);
            return this;
        }

        public Builder cooldownConfig(CooldownManagerConfig config) {
            if (config == null) {
                throw new IllegalArgumentException("config cannot be null");
            }
            this.cooldownConfig = config;
            return this;
        }

        public Builder subcommand(Builder subcommand) {
            if (subcommand == null) {
                throw new IllegalArgumentException("subcommand cannot be null");
            }
            subcommands.add(subcommand);
            return this;
        }

        public Builder callback(CommandCallback callback) {
            this.callback = callback;
            return this;
        }

        /**
         * false이면 남는 positional 토큰을 TooManyArguments로 거부 (기본값 true).
         */
        public Builder ignoreExtraArguments(boolean ignoreExtraArguments) {
            this.ignoreExtraArguments = ignoreExtraArguments;
            return this;
        }

        public String getName() {
            return name;
        }

        /**
         * 기본 변환기로 빌드.
         *
         * @return Command
         */
        public Command build() {
            return build(ConverterRegistry.withDefaults());
        }

        /**
         * 명령 확정.
         *
         * @param converters 파라미터 타입 → 변환기 매핑
         * @return Command
         * @throws IllegalArgumentException 파라미터 선언이 잘못되었거나 변환기가 없는 타입을 쓴 경우
         * @throws CommandExistsError 하위 명령 이름/별칭이 충돌하는 경우
         */
        public Command build(ConverterRegistry converters) {
            return build(converters, Inheritance.ROOT);
        }

        Command build(ConverterRegistry converters, Inheritance inheritance) {
            if (converters == null) {
                throw new IllegalArgumentException("converters cannot be null");
            }
            if (callback == null && subcommands.isEmpty()) {
                throw new IllegalArgumentException("Command \"" + name + "\" requires a callback or subcommands");
            }

            List<Parameter> resolvedParameters = applyDefaultDelimiter();
            validateParameters(resolvedParameters);

            List<ParameterBinding> bindings = new ArrayList<>(resolvedParameters.size());
            for (Parameter parameter : resolvedParameters) {
                bindings.add(new ParameterBinding(parameter, converters.resolve(parameter.type())));
            }

            GuardChain effectiveGuards = inheritance.guards().then(GuardChain.of(guards));
            List<InvocationHook> effectiveHooks = new ArrayList<>(inheritance.hooks());
            effectiveHooks.addAll(hooks);
            List<ErrorReporter> effectiveReporters = new ArrayList<>(errorReporters);
            effectiveReporters.addAll(inheritance.errorReporters());

            String qualified = inheritance.parentName() == null ? name : inheritance.parentName() + " " + name;
            Inheritance childInheritance = new Inheritance(
                inheritance.componentName(), qualified, effectiveGuards, effectiveHooks, effectiveReporters);

            List<Command> builtSubcommands = new ArrayList<>(subcommands.size());
            Map<String, String> taken = new LinkedHashMap<>();
            for (Builder sub : subcommands) {
                Command child = sub.build(converters, childInheritance);
                for (String candidate : child.names()) {
                    String existing = taken.putIfAbsent(candidate, child.getQualifiedName());
                    if (existing != null) {
                        throw new CommandExistsError(candidate, existing);
                    }
                }
                builtSubcommands.add(child);
            }

            return new Command(this, inheritance, bindings, effectiveGuards, effectiveHooks, effectiveReporters,
                builtSubcommands);
        }

        private List<Parameter> applyDefaultDelimiter() {
            List<Parameter> resolved = new ArrayList<>(parameters.size());
            for (Parameter parameter : parameters) {
                if (parameter.kind() == ParameterKind.SPECIAL && inheritsDelimiter.contains(parameter.name())) {
                    resolved.add(parameter.withDelimiter(delimiter));
                } else {
                    resolved.add(parameter);
                }
            }
            return resolved;
        }

        private void validateParameters(List<Parameter> declared) {
            Set<String> names = new HashSet<>();
            int firstSpecial = -1;
            int lastSpecial = -1;
            for (int i = 0; i < declared.size(); i++) {
                Parameter parameter = declared.get(i);
                if (!names.add(parameter.name())) {
                    throw new IllegalArgumentException(
                        "Duplicate parameter \"" + parameter.name() + "\" in command \"" + name + "\"");
                }
                if (parameter.kind() == ParameterKind.CONSUME_REST && i != declared.size() - 1) {
                    throw new IllegalArgumentException(
                        "Consume-rest parameter \"" + parameter.name() + "\" must be the last parameter of \"" + name + "\"");
                }
                if (parameter.kind() == ParameterKind.SPECIAL) {
                    if (firstSpecial < 0) {
                        firstSpecial = i;
                    } else if (lastSpecial != i - 1) {
                        throw new IllegalArgumentException(
                            "Special parameters of \"" + name + "\" must be declared contiguously");
                    }
                    lastSpecial = i;
                }
            }
        }

        private static void validateName(String value, String label) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(label + " cannot be null or blank");
            }
            if (value.chars().anyMatch(Character::isWhitespace)) {
                throw new IllegalArgumentException(label + " cannot contain whitespace (current: \"" + value + "\")");
            }
        }
    }
}
