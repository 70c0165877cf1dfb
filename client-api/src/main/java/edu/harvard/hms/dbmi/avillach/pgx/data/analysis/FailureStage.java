package edu.harvard.hms.dbmi.avillach.pgx.data.analysis;

public enum FailureStage {
    /** no risk verdict could be produced (unknown allele, missing diplotype, no rule) */
    VERDICT,
    /** the verdict stands but its explanation could not be generated */
    EXPLANATION,
    CANCELLED,
    ORCHESTRATION
}
