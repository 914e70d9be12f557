/**
 * Argument parsing: tokenizing the text after the command name and binding tokens to
 * declared parameters.
 *
 * <p>{@link com.ryuqq.chatcommand.core.parse.Tokenizer} never blocks.
 * {@link com.ryuqq.chatcommand.core.parse.ArgumentBinder} converts each value as soon as it is
 * bound, so converters may block and the first failure stops binding.</p>
 *
 * @since 1.0.0
 * @author ChatCommand Team
 */
package com.ryuqq.chatcommand.core.parse;
