package io.ticketflow.agent;

/**
 * Performs the work described by a ticket. Implementations should honour
 * {@link AgentContext#cancellation()} and {@link AgentContext#timeout()}.
 */
public interface Agent {
    String id();

    AgentResult execute(AgentContext context) throws Exception;
}
