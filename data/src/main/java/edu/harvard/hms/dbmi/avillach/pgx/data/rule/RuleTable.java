package edu.harvard.hms.dbmi.avillach.pgx.data.rule;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableCollection;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import edu.harvard.hms.dbmi.avillach.pgx.data.genotype.AlleleCatalog;
import edu.harvard.hms.dbmi.avillach.pgx.data.genotype.Phenotype;
import edu.harvard.hms.dbmi.avillach.pgx.exception.CatalogConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Read-only lookup of dosing rules indexed by (gene, drug, phenotype). Each drug is governed by
 * exactly one gene. Drug names are matched case-insensitively and reported in the casing
 * used by the rule data.
 */
public class RuleTable {

	private static final Logger log = LoggerFactory.getLogger(RuleTable.class);

	private record RuleKey(String gene, String drug, Phenotype phenotype) {
	}

	private final ImmutableMap<RuleKey, DrugRule> rules;

	private final ImmutableMap<String, String> geneByDrug;

	private final ImmutableMap<String, String> drugDisplayNames;

	private final ImmutableSetMultimap<String, String> drugsByGene;

	public RuleTable(Collection<DrugRule> drugRules) {
		List<String> problems = new ArrayList<>();
		Map<RuleKey, DrugRule> ruleMap = new LinkedHashMap<>();
		Map<String, String> geneMap = new LinkedHashMap<>();
		Map<String, String> displayNames = new LinkedHashMap<>();

		for (DrugRule rule : drugRules) {
			if (rule.getGene() == null || rule.getDrug() == null || rule.getPhenotype() == null
					|| rule.getRiskLabel() == null || rule.getSeverity() == null || rule.getStrength() == null) {
				problems.add("rule " + rule.getDrug() + "/" + rule.getGene() + "/" + rule.getPhenotype()
						+ " is missing a key, risk label, severity or strength");
				continue;
			}
			String gene = AlleleCatalog.normalizeGene(rule.getGene());
			String drug = normalizeDrug(rule.getDrug());
			String previousGene = geneMap.putIfAbsent(drug, gene);
			if (previousGene != null && !previousGene.equals(gene)) {
				problems.add("drug " + rule.getDrug() + " is governed by both " + previousGene + " and " + gene);
				continue;
			}
			displayNames.putIfAbsent(drug, rule.getDrug().trim());
			if (ruleMap.putIfAbsent(new RuleKey(gene, drug, rule.getPhenotype()), rule) != null) {
				problems.add("duplicate rule for " + rule.getDrug() + " " + gene + " " + rule.getPhenotype());
			}
		}
		if (!problems.isEmpty()) {
			throw new CatalogConfigurationException(problems);
		}
		ImmutableSetMultimap.Builder<String, String> byGene = ImmutableSetMultimap.builder();
		geneMap.forEach((drug, gene) -> byGene.put(gene, displayNames.get(drug)));

		this.rules = ImmutableMap.copyOf(ruleMap);
		this.geneByDrug = ImmutableMap.copyOf(geneMap);
		this.drugDisplayNames = ImmutableMap.copyOf(displayNames);
		this.drugsByGene = byGene.build();
	}

	public static RuleTable load(InputStream in) throws IOException {
		List<DrugRule> drugRules = new ObjectMapper().readValue(in, new TypeReference<List<DrugRule>>() {});
		RuleTable table = new RuleTable(drugRules);
		log.info("Loaded " + table.rules.size() + " dosing rules for " + table.geneByDrug.size() + " drugs");
		return table;
	}

	public static String normalizeDrug(String drug) {
		return drug == null ? "" : drug.trim().toLowerCase(Locale.ENGLISH);
	}

	public Optional<DrugRule> find(String gene, String drug, Phenotype phenotype) {
		return Optional.ofNullable(rules.get(new RuleKey(AlleleCatalog.normalizeGene(gene), normalizeDrug(drug), phenotype)));
	}

	/**
	 * @return the gene whose phenotype determines the verdict for the drug
	 */
	public Optional<String> geneFor(String drug) {
		return Optional.ofNullable(geneByDrug.get(normalizeDrug(drug)));
	}

	public Optional<String> displayName(String drug) {
		return Optional.ofNullable(drugDisplayNames.get(normalizeDrug(drug)));
	}

	public ImmutableSet<String> getDrugs() {
		return ImmutableSet.copyOf(drugDisplayNames.values());
	}

	public ImmutableSet<String> getGenes() {
		return drugsByGene.keySet();
	}

	public ImmutableSet<String> drugsForGene(String gene) {
		return drugsByGene.get(AlleleCatalog.normalizeGene(gene));
	}

	public ImmutableCollection<DrugRule> getRules() {
		return rules.values();
	}

	public int size() {
		return rules.size();
	}
}
