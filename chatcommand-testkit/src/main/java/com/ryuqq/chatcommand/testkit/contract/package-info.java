/**
 * Contract test kit for the chat command dispatcher.
 *
 * <p>{@link com.ryuqq.chatcommand.testkit.contract.AbstractDispatcherContractTest} plus the
 * recording collaborators and clock it wires in. Adapter implementations can extend the base
 * class to run the same scenarios.</p>
 *
 * @since 1.0.0
 * @author ChatCommand Team
 */
package com.ryuqq.chatcommand.testkit.contract;
