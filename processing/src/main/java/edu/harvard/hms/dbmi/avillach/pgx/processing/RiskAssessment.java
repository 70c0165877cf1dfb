package edu.harvard.hms.dbmi.avillach.pgx.processing;

import edu.harvard.hms.dbmi.avillach.pgx.data.genotype.Phenotype;
import edu.harvard.hms.dbmi.avillach.pgx.data.rule.DrugRule;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class RiskAssessment {
	String gene;
	/** drug name as written in the rule table */
	String drug;
	Phenotype phenotype;
	DrugRule rule;
	double confidence;
	Instant assessedAt;
}
