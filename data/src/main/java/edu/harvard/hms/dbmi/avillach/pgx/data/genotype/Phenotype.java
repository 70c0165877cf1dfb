package edu.harvard.hms.dbmi.avillach.pgx.data.genotype;

/**
 * Functional classification derived from a diplotype. Metabolizing enzymes use the
 * metabolizer scale, transporters use the function scale.
 */
public enum Phenotype {
	ULTRA_RAPID("Ultra-Rapid Metabolizer"),
	RAPID("Rapid Metabolizer"),
	NORMAL("Normal Metabolizer"),
	INTERMEDIATE("Intermediate Metabolizer"),
	POOR("Poor Metabolizer"),
	NO_FUNCTION("No Function Metabolizer"),
	INCREASED_FUNCTION("Increased Function"),
	NORMAL_FUNCTION("Normal Function"),
	DECREASED_FUNCTION("Decreased Function"),
	POOR_FUNCTION("Poor Function"),
	INDETERMINATE("Indeterminate");

	private final String displayName;

	Phenotype(String displayName) {
		this.displayName = displayName;
	}

	public String getDisplayName() {
		return displayName;
	}
}
