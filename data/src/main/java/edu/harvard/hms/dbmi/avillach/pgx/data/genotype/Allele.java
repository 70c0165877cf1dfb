package edu.harvard.hms.dbmi.avillach.pgx.data.genotype;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;

@Jacksonized
@Value
@Builder(toBuilder = true)
public class Allele implements Serializable {

	private static final long serialVersionUID = 5013784413720598402L;

	String gene;
	String label;
	FunctionalStatus status;
	/**
	 * Contribution of this allele to the diplotype activity score. Null only when the
	 * function of the allele is unknown.
	 */
	Double activity;

	public boolean hasKnownFunction() {
		return status != FunctionalStatus.UNKNOWN && activity != null;
	}
}
