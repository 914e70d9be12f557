/**
 * Transport-neutral inbound model: chat messages, chatters and parameter declarations.
 *
 * @since 1.0.0
 * @author ChatCommand Team
 */
package com.ryuqq.chatcommand.core.model;
