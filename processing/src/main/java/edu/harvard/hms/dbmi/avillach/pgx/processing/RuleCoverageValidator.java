package edu.harvard.hms.dbmi.avillach.pgx.processing;

import edu.harvard.hms.dbmi.avillach.pgx.data.genotype.AlleleCatalog;
import edu.harvard.hms.dbmi.avillach.pgx.data.genotype.Phenotype;
import edu.harvard.hms.dbmi.avillach.pgx.data.rule.RuleTable;
import edu.harvard.hms.dbmi.avillach.pgx.exception.CatalogConfigurationException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Refuses to start when a drug lacks a rule for a phenotype its gene can produce, so that a
 * classification can never fall through to a default verdict at runtime.
 */
@Component
public class RuleCoverageValidator {

	private static final Logger log = LoggerFactory.getLogger(RuleCoverageValidator.class);

	private final AlleleCatalog catalog;
	private final RuleTable ruleTable;
	private final DiplotypeResolver resolver;

	@Autowired
	public RuleCoverageValidator(AlleleCatalog catalog, RuleTable ruleTable, DiplotypeResolver resolver) {
		this.catalog = catalog;
		this.ruleTable = ruleTable;
		this.resolver = resolver;
	}

	@PostConstruct
	public void validate() {
		List<String> problems = findGaps();
		if (!problems.isEmpty()) {
			problems.forEach(problem -> log.error("Rule table gap: " + problem));
			throw new CatalogConfigurationException(problems);
		}
		log.info("Rule table covers every producible phenotype for " + ruleTable.getDrugs().size() + " drugs");
	}

	public List<String> findGaps() {
		List<String> problems = new ArrayList<>();
		for (String gene : ruleTable.getGenes()) {
			if (!catalog.containsGene(gene)) {
				problems.add("rules reference gene " + gene + " which is not in the allele catalog");
				continue;
			}
			for (Phenotype phenotype : resolver.produciblePhenotypes(gene)) {
				for (String drug : ruleTable.drugsForGene(gene)) {
					if (ruleTable.find(gene, drug, phenotype).isEmpty()) {
						problems.add("no rule for " + drug + " when " + gene + " is " + phenotype);
					}
				}
			}
		}
		return problems;
	}
}
