package io.ticketflow.detach;

public record BackgroundStatus(boolean running, long pid, String pidFile, String logDir) {
    static BackgroundStatus idle(String pidFile, String logDir) {
        return new BackgroundStatus(false, 0L, pidFile, logDir);
    }
}
