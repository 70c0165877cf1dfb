package edu.harvard.hms.dbmi.avillach.pgx.data.rule;

import edu.harvard.hms.dbmi.avillach.pgx.data.genotype.Phenotype;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;

/**
 * Guideline verdict for one (gene, drug, phenotype) combination.
 */
@Jacksonized
@Value
@Builder
public class DrugRule implements Serializable {

	private static final long serialVersionUID = -7960950893236716146L;

	String gene;
	String drug;
	Phenotype phenotype;
	RiskLabel riskLabel;
	Severity severity;
	RiskCategory category;
	String summary;
	String dosing;
	String monitoring;
	/** CPIC level of evidence, e.g. 1A */
	String evidenceLevel;
	RecommendationStrength strength;
	String citation;
}
