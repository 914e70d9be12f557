/**
 * Guards: ordered, short-circuiting permission predicates evaluated after argument binding
 * and before cooldowns.
 *
 * @since 1.0.0
 * @author ChatCommand Team
 */
package com.ryuqq.chatcommand.core.guard;
