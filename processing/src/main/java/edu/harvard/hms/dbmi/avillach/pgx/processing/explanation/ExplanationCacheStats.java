package edu.harvard.hms.dbmi.avillach.pgx.processing.explanation;

public record ExplanationCacheStats(int entries, long hits, long misses, long writes, long conflicts) {
}
