/**
 * ticketflow source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.ticketflow.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.ticketflow.cli.TicketFlowCommand} maps commands onto the store and scheduler.</li>
 *   <li>{@code io.ticketflow.runtime.WorkScheduler} runs pending tickets through the agent in dependency waves.</li>
 *   <li>{@code io.ticketflow.storage.TicketStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.ticketflow;
