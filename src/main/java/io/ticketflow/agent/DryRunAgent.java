package io.ticketflow.agent;

public final class DryRunAgent implements Agent {
    public static final String OUTPUT = "[DRY RUN] agent call skipped";

    @Override
    public String id() {
        return "dry-run";
    }

    @Override
    public AgentResult execute(AgentContext context) {
        return AgentResult.ok(OUTPUT);
    }
}
