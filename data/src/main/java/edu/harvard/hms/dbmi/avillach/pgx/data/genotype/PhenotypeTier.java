package edu.harvard.hms.dbmi.avillach.pgx.data.genotype;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;

/**
 * One row of a gene's tier table: diplotypes whose activity score is at least
 * {@code minActivity} (and below the previous row) resolve to {@code phenotype}.
 */
@Jacksonized
@Value
@Builder
public class PhenotypeTier implements Serializable {

	private static final long serialVersionUID = -4632145911280739417L;

	Phenotype phenotype;
	double minActivity;
}
