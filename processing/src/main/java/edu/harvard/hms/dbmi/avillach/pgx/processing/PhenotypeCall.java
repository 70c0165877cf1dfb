package edu.harvard.hms.dbmi.avillach.pgx.processing;

import edu.harvard.hms.dbmi.avillach.pgx.data.genotype.Diplotype;
import edu.harvard.hms.dbmi.avillach.pgx.data.genotype.Phenotype;

/**
 * Phenotype resolved for one gene, together with the canonical diplotype it was resolved from.
 *
 * @param activityScore summed allele activity, null when the phenotype is indeterminate
 */
public record PhenotypeCall(String gene, Diplotype diplotype, Phenotype phenotype, Double activityScore) {
}
