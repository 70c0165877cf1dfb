package edu.harvard.hms.dbmi.avillach.pgx.data.genotype;

public enum FunctionalStatus {
	NORMAL,
	REDUCED,
	NON_FUNCTIONAL,
	INCREASED,
	/** function not established; a diplotype carrying such an allele resolves to an indeterminate phenotype */
	UNKNOWN
}
