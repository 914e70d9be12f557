package com.ryuqq.chatcommand.core.context;

import com.ryuqq.chatcommand.core.contract.Command;
import com.ryuqq.chatcommand.core.model.ChatMessage;
import com.ryuqq.chatcommand.core.model.Chatter;
import com.ryuqq.chatcommand.core.parse.TokenizedArguments;
import com.ryuqq.chatcommand.core.spi.MessageSender;
import com.ryuqq.chatcommand.core.statemachine.DispatchState;
import com.ryuqq.chatcommand.core.statemachine.StateTransition;

/**
 * 메시지 한 건에 대한 호출 컨텍스트 (Invocation).
 *
 * <p>접두사가 일치한 메시지마다 Dispatcher가 생성하며, 처리가 끝나면 버려집니다.
 * 한 호출은 한 스레드에서만 진행되지만, 비동기 dispatch 결과를 다른 스레드가 읽을 수 있도록
 * 상태는 volatile로 공개됩니다.</p>
 *
 * <p><strong>채워지는 순서:</strong></p>
 * <ol>
 *   <li>생성: 원본 메시지, 접두사</li>
 *   <li>LOOKUP: 호출 이름, 명령, 하위 명령 트리거, 인자 문자열</li>
 *   <li>TOKENIZE: 토큰</li>
 *   <li>BIND: 바인딩된 인자</li>
 * </ol>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class CommandContext {

    private final ChatMessage message;
    private final String prefix;
    private final MessageSender sender;

    private volatile DispatchState state = DispatchState.PREFIX_MATCH;
    private volatile String invokedWith;
    private volatile Command command;
    private volatile String subcommandTrigger;
    private volatile String argumentText = "";
    private volatile TokenizedArguments tokens = TokenizedArguments.empty();
    private volatile BoundArguments arguments = BoundArguments.empty();

    /**
     * @param message 수신 메시지
     * @param prefix 일치한 접두사
     * @param sender 응답 전송기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CommandContext(ChatMessage message, String prefix, MessageSender sender) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        if (sender == null) {
            throw new IllegalArgumentException("sender cannot be null");
        }
        this.message = message;
        this.prefix = prefix;
        this.sender = sender;
    }

    /**
     * 상태 전이 (검증 후).
     *
     * @param next 다음 상태
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public void transitionTo(DispatchState next) {
        this.state = StateTransition.transition(state, next);
    }

    /**
     * 조회 결과 기록.
     *
     * @param invokedWith 실제로 입력된 명령 이름 (최상위)
     * @param command 최종적으로 실행될 명령 (하위 명령이면 하위 명령)
     * @param subcommandTrigger 하위 명령을 선택한 토큰 (없으면 null)
     * @param argumentText 명령 이름 뒤의 인자 문자열
     */
    public void resolveCommand(String invokedWith, Command command, String subcommandTrigger, String argumentText) {
        if (invokedWith == null || command == null) {
            throw new IllegalArgumentException("invokedWith and command cannot be null");
        }
        this.invokedWith = invokedWith;
        this.command = command;
        this.subcommandTrigger = subcommandTrigger;
        this.argumentText = argumentText == null ? "" : argumentText;
    }

    /**
     * 호출 이름만 기록 (명령을 찾지 못한 경우).
     *
     * @param invokedWith 입력된 명령 이름
     */
    public void recordInvokedWith(String invokedWith) {
        this.invokedWith = invokedWith;
    }

    public void attachTokens(TokenizedArguments tokens) {
        if (tokens == null) {
            throw new IllegalArgumentException("tokens cannot be null");
        }
        this.tokens = tokens;
    }

    public void attachArguments(BoundArguments arguments) {
        if (arguments == null) {
            throw new IllegalArgumentException("arguments cannot be null");
        }
        this.arguments = arguments;
    }

    /**
     * 호출이 발생한 채널로 메시지 전송.
     *
     * @param text 본문
     * @throws Exception 전송 실패 시
     */
    public void send(String text) throws Exception {
        sender.send(this, text);
    }

    /**
     * 바인딩된 인자 조회.
     *
     * @param name 파라미터 이름
     * @param type 기대 타입
     * @param <T> 기대 타입
     * @return 값 (값 없음이면 null)
     */
    public <T> T argument(String name, Class<T> type) {
        return arguments.get(name, type);
    }

    public ChatMessage getMessage() {
        return message;
    }

    public Chatter chatter() {
        return message.chatter();
    }

    public String channelId() {
        return message.channelId();
    }

    public String getPrefix() {
        return prefix;
    }

    public DispatchState getState() {
        return state;
    }

    /**
     * 입력된 명령 이름 (LOOKUP 이전이면 null).
     */
    public String getInvokedWith() {
        return invokedWith;
    }

    /**
     * 실행 대상 명령 (LOOKUP 이전 또는 조회 실패 시 null).
     */
    public Command getCommand() {
        return command;
    }

    public String getSubcommandTrigger() {
        return subcommandTrigger;
    }

    public String getArgumentText() {
        return argumentText;
    }

    public TokenizedArguments getTokens() {
        return tokens;
    }

    public BoundArguments getArguments() {
        return arguments;
    }

    @Override
    public String toString() {
        return "CommandContext{" +
            "state=" + state +
            ", invokedWith='" + invokedWith + '\'' +
            ", channelId='" + message.channelId() + '\'' +
            ", chatter='" + message.chatter().login() + '\'' +
            '}';
    }
}
