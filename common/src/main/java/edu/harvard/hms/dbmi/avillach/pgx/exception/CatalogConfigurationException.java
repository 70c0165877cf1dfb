package edu.harvard.hms.dbmi.avillach.pgx.exception;

import java.util.List;

/**
 * Reference data is inconsistent, for example a phenotype the resolver can produce has no
 * dosing rule for a drug governed by that gene. This is raised while the catalog is loaded
 * so that the service refuses to start rather than answering with a default verdict.
 */
public class CatalogConfigurationException extends RuntimeException {

	private static final long serialVersionUID = -8437921547530391016L;

	private final List<String> problems;

	public CatalogConfigurationException(List<String> problems) {
		super("Invalid pharmacogenomic reference data: " + String.join("; ", problems));
		this.problems = List.copyOf(problems);
	}

	public CatalogConfigurationException(String problem, Throwable cause) {
		super("Invalid pharmacogenomic reference data: " + problem, cause);
		this.problems = List.of(problem);
	}

	public List<String> getProblems() {
		return problems;
	}
}
