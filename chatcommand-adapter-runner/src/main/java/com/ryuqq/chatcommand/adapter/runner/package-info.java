/**
 * Dispatcher runtime.
 *
 * <p>{@link com.ryuqq.chatcommand.adapter.runner.CommandDispatcher} runs the dispatch pipeline on
 * the caller's thread or on a fixed-size worker pool configured by
 * {@link com.ryuqq.chatcommand.adapter.runner.DispatcherConfig}.</p>
 *
 * @since 1.0.0
 * @author ChatCommand Team
 */
package com.ryuqq.chatcommand.adapter.runner;
