package io.scheduler4j.core;

public enum RunStatus {

    RUNNING(false),
    SUCCESS(true),
    ERROR(true);

    private final boolean terminal;

    RunStatus(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
