package io.ticketflow.detach;

@FunctionalInterface
public interface ProcessLiveness {
    boolean isAlive(long pid);

    static ProcessLiveness system() {
        return pid -> pid > 0 && ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }
}
