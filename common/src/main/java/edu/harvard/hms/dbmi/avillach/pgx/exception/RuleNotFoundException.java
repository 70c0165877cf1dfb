package edu.harvard.hms.dbmi.avillach.pgx.exception;

public class RuleNotFoundException extends RuntimeException {

	private static final long serialVersionUID = 6851240478931204157L;

	public RuleNotFoundException(String gene, String drug, String phenotype) {
		super("No dosing rule for drug " + drug + " with " + gene + " phenotype " + phenotype
				+ ". A missing rule is never reported as a safe verdict.");
	}

	public RuleNotFoundException(String drug) {
		super("Drug " + drug + " is not covered by the rule table");
	}
}
