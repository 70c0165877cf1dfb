package edu.harvard.hms.dbmi.avillach.pgx.data.genotype;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import edu.harvard.hms.dbmi.avillach.pgx.exception.CatalogConfigurationException;
import edu.harvard.hms.dbmi.avillach.pgx.exception.InvalidGenotypeException;
import edu.harvard.hms.dbmi.avillach.pgx.exception.UnknownAlleleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Read-only lookup of the alleles recognized per gene, indexed by (gene, allele label), and of
 * each gene's tier table. Gene symbols are matched case-insensitively; allele labels are
 * matched exactly after trimming.
 */
public class AlleleCatalog {

	private static final Logger log = LoggerFactory.getLogger(AlleleCatalog.class);

	private final ImmutableMap<String, GeneDefinition> genes;

	private final ImmutableTable<String, String, Allele> alleles;

	public AlleleCatalog(Collection<GeneDefinition> definitions) {
		List<String> problems = new ArrayList<>();
		ImmutableMap.Builder<String, GeneDefinition> geneBuilder = ImmutableMap.builder();
		ImmutableTable.Builder<String, String, Allele> alleleBuilder = ImmutableTable.builder();
		Set<String> seenGenes = new HashSet<>();

		for (GeneDefinition definition : definitions) {
			if (definition.getSymbol() == null || definition.getSymbol().isBlank()) {
				problems.add("gene definition without a symbol");
				continue;
			}
			String symbol = normalizeGene(definition.getSymbol());
			if (!seenGenes.add(symbol)) {
				problems.add("gene " + symbol + " is defined more than once");
				continue;
			}
			problems.addAll(checkTiers(symbol, definition.getTiers()));

			ImmutableList.Builder<Allele> geneAlleles = ImmutableList.builder();
			Set<String> seenLabels = new HashSet<>();
			for (Allele allele : Optional.ofNullable(definition.getAlleles()).orElse(List.of())) {
				String label = allele.getLabel() == null ? "" : allele.getLabel().trim();
				if (label.isEmpty() || !seenLabels.add(label)) {
					problems.add(symbol + " allele '" + label + "' is blank or defined more than once");
					continue;
				}
				if (allele.getStatus() == null) {
					problems.add(symbol + " " + label + " has no functional status");
				} else if (allele.getStatus() != FunctionalStatus.UNKNOWN
						&& (allele.getActivity() == null || allele.getActivity() < 0)) {
					problems.add(symbol + " " + label + " needs a non-negative activity value");
				}
				Allele normalized = allele.toBuilder().gene(symbol).label(label).build();
				geneAlleles.add(normalized);
				alleleBuilder.put(symbol, label, normalized);
			}
			geneBuilder.put(symbol, GeneDefinition.builder()
					.symbol(symbol)
					.geneClass(definition.getGeneClass())
					.description(definition.getDescription())
					.tiers(definition.getTiers() == null ? ImmutableList.of() : ImmutableList.copyOf(definition.getTiers()))
					.alleles(geneAlleles.build())
					.build());
		}
		if (!problems.isEmpty()) {
			throw new CatalogConfigurationException(problems);
		}
		this.genes = geneBuilder.build();
		this.alleles = alleleBuilder.build();
	}

	public static AlleleCatalog load(InputStream in) throws IOException {
		List<GeneDefinition> definitions = new ObjectMapper().readValue(in, new TypeReference<List<GeneDefinition>>() {});
		AlleleCatalog catalog = new AlleleCatalog(definitions);
		log.info("Loaded allele catalog with " + catalog.genes.size() + " genes and " + catalog.alleles.size() + " alleles");
		return catalog;
	}

	private static List<String> checkTiers(String symbol, List<PhenotypeTier> tiers) {
		if (tiers == null || tiers.isEmpty()) {
			return List.of(symbol + " has no phenotype tiers");
		}
		List<String> problems = new ArrayList<>();
		for (int i = 1; i < tiers.size(); i++) {
			if (tiers.get(i).getMinActivity() >= tiers.get(i - 1).getMinActivity()) {
				problems.add(symbol + " tiers must be ordered by strictly decreasing minimum activity");
				break;
			}
		}
		if (tiers.get(tiers.size() - 1).getMinActivity() > 0) {
			problems.add(symbol + " lowest tier must accept an activity score of 0");
		}
		for (PhenotypeTier tier : tiers) {
			if (tier.getPhenotype() == null || tier.getPhenotype() == Phenotype.INDETERMINATE) {
				problems.add(symbol + " tiers must name a determinate phenotype");
			}
		}
		return problems;
	}

	public static String normalizeGene(String gene) {
		return gene == null ? "" : gene.trim().toUpperCase(Locale.ENGLISH);
	}

	public Set<String> getGeneSymbols() {
		return genes.keySet();
	}

	public boolean containsGene(String gene) {
		return genes.containsKey(normalizeGene(gene));
	}

	public GeneDefinition getGene(String gene) {
		GeneDefinition definition = genes.get(normalizeGene(gene));
		if (definition == null) {
			throw new InvalidGenotypeException(gene, "Gene " + gene + " is not in the allele catalog");
		}
		return definition;
	}

	public Allele getAllele(String gene, String label) {
		GeneDefinition definition = getGene(gene);
		Allele allele = label == null ? null : alleles.get(definition.getSymbol(), label.trim());
		if (allele == null) {
			throw new UnknownAlleleException(definition.getSymbol(), label);
		}
		return allele;
	}

	public List<Allele> getAlleles(String gene) {
		return getGene(gene).getAlleles();
	}

	public Diplotype diplotype(String gene, String allele1, String allele2) {
		return Diplotype.of(getAllele(gene, allele1), getAllele(gene, allele2));
	}
}
