package io.ticketflow.agent;

import io.ticketflow.model.Ticket;

import java.time.Duration;

public record AgentContext(
        Ticket ticket,
        CancellationToken cancellation,
        Duration timeout,
        String runId
) {
}
