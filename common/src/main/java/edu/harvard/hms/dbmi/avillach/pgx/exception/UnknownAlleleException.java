package edu.harvard.hms.dbmi.avillach.pgx.exception;

/**
 * Thrown when a genotype call references an allele label that the catalog does not
 * define for the gene. Submissions carrying such an allele are rejected before a job
 * is created.
 */
public class UnknownAlleleException extends InvalidGenotypeException {

	private static final long serialVersionUID = -3380874310645951275L;

	private final String allele;

	public UnknownAlleleException(String gene, String allele) {
		super(gene, "Allele " + allele + " is not a recognized allele of " + gene);
		this.allele = allele;
	}

	public String getAllele() {
		return allele;
	}
}
