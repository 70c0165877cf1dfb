package edu.harvard.hms.dbmi.avillach.pgx.data.rule;

public enum RiskLabel {
	LOW("Low"),
	MODERATE("Moderate"),
	HIGH("High");

	private final String displayName;

	RiskLabel(String displayName) {
		this.displayName = displayName;
	}

	public String getDisplayName() {
		return displayName;
	}
}
