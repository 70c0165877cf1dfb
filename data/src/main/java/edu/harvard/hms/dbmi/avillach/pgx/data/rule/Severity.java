package edu.harvard.hms.dbmi.avillach.pgx.data.rule;

import java.util.Locale;

public enum Severity {
	NONE,
	LOW,
	MODERATE,
	HIGH,
	CRITICAL;

	public String getDisplayName() {
		return name().toLowerCase(Locale.ENGLISH);
	}
}
