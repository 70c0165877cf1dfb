package edu.harvard.hms.dbmi.avillach.pgx.exception;

public class GeneratorUnavailableException extends RuntimeException {

	private static final long serialVersionUID = 3904412264870263081L;

	private final boolean retryable;

	public GeneratorUnavailableException(String message, boolean retryable) {
		super(message);
		this.retryable = retryable;
	}

	public GeneratorUnavailableException(String message, boolean retryable, Throwable cause) {
		super(message, cause);
		this.retryable = retryable;
	}

	/**
	 * @return true when a later attempt may succeed (server errors, throttling, connection failures)
	 */
	public boolean isRetryable() {
		return retryable;
	}
}
