/**
 * Converter engine.
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>Built-ins - {@link com.ryuqq.chatcommand.core.convert.BuiltinConverters}</li>
 *   <li>Function-shaped - {@link com.ryuqq.chatcommand.core.convert.FunctionConverter}</li>
 *   <li>Class-shaped - any class implementing {@link com.ryuqq.chatcommand.core.convert.Converter},
 *       e.g. {@link com.ryuqq.chatcommand.core.convert.EntityConverter}</li>
 *   <li>Union / optional - {@link com.ryuqq.chatcommand.core.convert.UnionConverter}</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.chatcommand.core.convert.ConverterRegistry} maps declared types to converters
 * when a command is built.</p>
 *
 * @since 1.0.0
 * @author ChatCommand Team
 */
package com.ryuqq.chatcommand.core.convert;
