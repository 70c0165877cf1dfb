package edu.harvard.hms.dbmi.avillach.pgx.exception;

public class InvalidGenotypeException extends RuntimeException {

	private static final long serialVersionUID = 4127366020813575913L;

	private final String gene;

	public InvalidGenotypeException(String gene, String message) {
		super(message);
		this.gene = gene;
	}

	public String getGene() {
		return gene;
	}
}
