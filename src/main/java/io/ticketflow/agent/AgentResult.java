package io.ticketflow.agent;

public record AgentResult(
        boolean success,
        String output,
        String error,
        String logPath
) {
    public static AgentResult ok(String output) {
        return new AgentResult(true, output, null, null);
    }

    public static AgentResult ok(String output, String logPath) {
        return new AgentResult(true, output, null, logPath);
    }

    public static AgentResult fail(String error) {
        return new AgentResult(false, null, error, null);
    }

    public static AgentResult fail(String error, String logPath) {
        return new AgentResult(false, null, error, logPath);
    }
}
