/**
 * Cooldowns (rate limits) per command.
 *
 * <p>Algorithms ({@link com.ryuqq.chatcommand.core.cooldown.FixedWindowCooldown},
 * {@link com.ryuqq.chatcommand.core.cooldown.GcraCooldown}) are stateless; the per-command
 * {@link com.ryuqq.chatcommand.core.cooldown.CooldownManager} owns the keyed state and performs
 * read-evaluate-commit atomically across every cooldown of the command.</p>
 *
 * @since 1.0.0
 * @author ChatCommand Team
 */
package com.ryuqq.chatcommand.core.cooldown;
