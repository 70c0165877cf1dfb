package edu.harvard.hms.dbmi.avillach.pgx.data.rule;

public enum RecommendationStrength {
	STRONG("Strong", 0.95),
	MODERATE("Moderate", 0.85),
	OPTIONAL("Optional", 0.70),
	NONE("No Recommendation", 0.50);

	private final String displayName;
	private final double confidence;

	RecommendationStrength(String displayName, double confidence) {
		this.displayName = displayName;
		this.confidence = confidence;
	}

	public String getDisplayName() {
		return displayName;
	}

	/**
	 * Confidence score reported with a verdict backed by a recommendation of this strength.
	 */
	public double getConfidence() {
		return confidence;
	}
}
