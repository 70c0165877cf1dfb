package edu.harvard.hms.dbmi.avillach.pgx.exception;

public class CacheKeyConflictException extends RuntimeException {

	private static final long serialVersionUID = -1862206394213004467L;

	private final String key;

	public CacheKeyConflictException(String key) {
		super("Cache key " + key + " already holds different content; the stored entry is kept");
		this.key = key;
	}

	public String getKey() {
		return key;
	}
}
