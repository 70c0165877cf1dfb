package edu.harvard.hms.dbmi.avillach.pgx.data.analysis;

public enum DrugOutcome {
    /** verdict and generated explanation */
    COMPLETE,
    /** verdict from the rule table, explanation missing */
    VERDICT_ONLY,
    NO_VERDICT
}
