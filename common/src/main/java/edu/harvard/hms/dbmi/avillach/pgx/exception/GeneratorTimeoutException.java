package edu.harvard.hms.dbmi.avillach.pgx.exception;

import java.time.Duration;

public class GeneratorTimeoutException extends RuntimeException {

	private static final long serialVersionUID = -5567310938725017248L;

	public GeneratorTimeoutException(Duration timeout) {
		super("Explanation generator did not answer within " + timeout.toMillis() + "ms");
	}
}
