package edu.harvard.hms.dbmi.avillach.pgx.data.analysis;

public enum JobState {
    QUEUED(false),
    RUNNING(false),
    COMPLETED(true),
    FAILED(true);

    private final boolean terminal;

    JobState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
