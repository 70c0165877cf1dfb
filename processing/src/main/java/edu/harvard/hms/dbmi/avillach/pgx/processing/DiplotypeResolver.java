package edu.harvard.hms.dbmi.avillach.pgx.processing;

import edu.harvard.hms.dbmi.avillach.pgx.data.genotype.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Maps a diplotype to its phenotype using the gene's tier table. A diplotype containing an
 * allele of unknown function resolves to {@link Phenotype#INDETERMINATE}; otherwise the two
 * activity values are summed and the first tier whose minimum the sum reaches is taken.
 */
@Component
public class DiplotypeResolver {

	private final AlleleCatalog catalog;

	@Autowired
	public DiplotypeResolver(AlleleCatalog catalog) {
		this.catalog = catalog;
	}

	public Phenotype resolve(String gene, String allele1, String allele2) {
		return call(gene, allele1, allele2).phenotype();
	}

	public PhenotypeCall call(String gene, String allele1, String allele2) {
		GeneDefinition definition = catalog.getGene(gene);
		Diplotype diplotype = catalog.diplotype(definition.getSymbol(), allele1, allele2);
		Double activityScore = diplotype.getActivityScore();
		return new PhenotypeCall(definition.getSymbol(), diplotype, phenotypeOf(definition, activityScore), activityScore);
	}

	/**
	 * Every phenotype some pair of catalog alleles resolves to for this gene.
	 */
	public Set<Phenotype> produciblePhenotypes(String gene) {
		GeneDefinition definition = catalog.getGene(gene);
		List<Allele> alleles = definition.getAlleles();
		Set<Phenotype> phenotypes = EnumSet.noneOf(Phenotype.class);
		for (int i = 0; i < alleles.size(); i++) {
			for (int j = i; j < alleles.size(); j++) {
				Diplotype diplotype = Diplotype.of(alleles.get(i), alleles.get(j));
				phenotypes.add(phenotypeOf(definition, diplotype.getActivityScore()));
			}
		}
		return phenotypes;
	}

	private static Phenotype phenotypeOf(GeneDefinition definition, Double activityScore) {
		if (activityScore == null) {
			return Phenotype.INDETERMINATE;
		}
		return definition.phenotypeFor(activityScore);
	}
}
