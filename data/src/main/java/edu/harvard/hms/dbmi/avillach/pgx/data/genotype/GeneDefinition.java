package edu.harvard.hms.dbmi.avillach.pgx.data.genotype;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.util.List;

@Jacksonized
@Value
@Builder
public class GeneDefinition implements Serializable {

	private static final long serialVersionUID = 2779386532917043925L;

	String symbol;
	GeneClass geneClass;
	String description;
	/** ordered from the highest minimum activity down; the last row must accept a score of zero */
	List<PhenotypeTier> tiers;
	List<Allele> alleles;

	public Phenotype phenotypeFor(double activityScore) {
		for (PhenotypeTier tier : tiers) {
			if (activityScore >= tier.getMinActivity()) {
				return tier.getPhenotype();
			}
		}
		throw new IllegalStateException("Tier table of " + symbol + " does not cover activity score " + activityScore);
	}
}
