package edu.harvard.hms.dbmi.avillach.pgx.processing.explanation;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.util.Objects;

@Jacksonized
@Value
@Builder
public class CacheEntry implements Serializable {

	private static final long serialVersionUID = 3407981262285530694L;

	String key;
	String text;
	String provider;
	String model;
	/** epoch millis */
	long createdAt;

	/**
	 * Two entries carry the same content when everything but the creation time matches.
	 */
	public boolean sameContent(CacheEntry other) {
		return other != null
				&& Objects.equals(key, other.key)
				&& Objects.equals(text, other.text)
				&& Objects.equals(provider, other.provider)
				&& Objects.equals(model, other.model);
	}
}
