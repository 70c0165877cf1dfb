package edu.harvard.hms.dbmi.avillach.pgx.exception;

public class JobNotFoundException extends RuntimeException {

	private static final long serialVersionUID = 2211493750286648110L;

	public JobNotFoundException(String jobId) {
		super("No analysis job with id " + jobId);
	}
}
