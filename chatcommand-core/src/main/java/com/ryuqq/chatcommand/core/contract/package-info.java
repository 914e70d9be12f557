/**
 * Registration contract: commands, command groups and components.
 *
 * <p>Commands are declared with a builder and become immutable on
 * {@link com.ryuqq.chatcommand.core.contract.Command.Builder#build(com.ryuqq.chatcommand.core.convert.ConverterRegistry)}.
 * Converters are resolved and guard chains assembled at that point, never at call time.</p>
 *
 * @since 1.0.0
 * @author ChatCommand Team
 */
package com.ryuqq.chatcommand.core.contract;
