package edu.harvard.hms.dbmi.avillach.pgx.processing;

import edu.harvard.hms.dbmi.avillach.pgx.data.genotype.Phenotype;
import edu.harvard.hms.dbmi.avillach.pgx.data.rule.DrugRule;
import edu.harvard.hms.dbmi.avillach.pgx.data.rule.RuleTable;
import edu.harvard.hms.dbmi.avillach.pgx.exception.RuleNotFoundException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class RiskClassifier {

	private final RuleTable ruleTable;

	private final Clock clock;

	@Autowired
	public RiskClassifier(RuleTable ruleTable, Clock clock) {
		this.ruleTable = ruleTable;
		this.clock = clock;
	}

	/**
	 * Looks up the dosing rule for the phenotype. There is no fallback verdict: a combination
	 * missing from the rule table is an error.
	 */
	public RiskAssessment classify(String gene, Phenotype phenotype, String drug) {
		DrugRule rule = ruleTable.find(gene, drug, phenotype)
				.orElseThrow(() -> new RuleNotFoundException(gene, drug, phenotype.name()));
		return RiskAssessment.builder()
				.gene(rule.getGene())
				.drug(rule.getDrug())
				.phenotype(phenotype)
				.rule(rule)
				.confidence(rule.getStrength().getConfidence())
				.assessedAt(clock.instant())
				.build();
	}

	/**
	 * @return the gene that governs the drug
	 * @throws RuleNotFoundException when the drug is not covered at all
	 */
	public String geneFor(String drug) {
		return ruleTable.geneFor(drug).orElseThrow(() -> new RuleNotFoundException(drug));
	}
}
