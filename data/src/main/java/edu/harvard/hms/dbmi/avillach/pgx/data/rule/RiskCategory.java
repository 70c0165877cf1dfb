package edu.harvard.hms.dbmi.avillach.pgx.data.rule;

/**
 * Clinical consequence a rule predicts for the patient.
 */
public enum RiskCategory {
	SAFE("Safe"),
	ADJUST_DOSAGE("Adjust Dosage"),
	TOXIC("Toxic"),
	INEFFECTIVE("Ineffective"),
	UNKNOWN("Unknown");

	private final String displayName;

	RiskCategory(String displayName) {
		this.displayName = displayName;
	}

	public String getDisplayName() {
		return displayName;
	}
}
