package edu.harvard.hms.dbmi.avillach.pgx.data.analysis;

/**
 * Progress of one requested drug within an analysis job. States are ordered; a drug only
 * ever moves to a later state, and {@link #DONE} and {@link #FAILED} are final.
 */
public enum DrugState {
    PENDING(0),
    RESOLVING(1),
    EXPLAINING(2),
    DONE(3),
    FAILED(3);

    private final int rank;

    DrugState(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public boolean canAdvanceTo(DrugState next) {
        return !isTerminal() && next.rank > rank;
    }
}
