/**
 * ChatCommand Application Layer - 메시지 dispatch API.
 *
 * <p>전송 계층이 수신한 메시지를 넘겨주는 포트입니다.
 * 구현체는 chatcommand-adapter-runner 모듈에 있습니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.chatcommand.application.dispatcher.Dispatcher} - 동기/비동기 dispatch</li>
 * </ul>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
package com.ryuqq.chatcommand.application.dispatcher;
