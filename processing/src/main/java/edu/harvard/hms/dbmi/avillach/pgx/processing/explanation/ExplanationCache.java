package edu.harvard.hms.dbmi.avillach.pgx.processing.explanation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;
import edu.harvard.hms.dbmi.avillach.pgx.exception.CacheKeyConflictException;
import edu.harvard.hms.dbmi.avillach.pgx.storage.FileBackedJsonIndexStorage;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Durable, content-addressed store of generated explanation sections. Entries are appended
 * to {@code explanations.log} and never rewritten or evicted; a bounded Guava cache keeps
 * recently used entries in memory in front of the file.
 *
 * Writing a second, different text under an existing key is refused and the original is kept.
 */
@Component
public class ExplanationCache {

	private static final Logger log = LoggerFactory.getLogger(ExplanationCache.class);

	static final String LOG_FILE_NAME = "explanations.log";

	private final ExplanationLog storage;

	private final LoadingCache<String, Optional<CacheEntry>> memory;

	private final AtomicLong hits = new AtomicLong();
	private final AtomicLong misses = new AtomicLong();
	private final AtomicLong writes = new AtomicLong();
	private final AtomicLong conflicts = new AtomicLong();

	@Autowired
	public ExplanationCache(
		@Value("${PGX_CACHE_DIRECTORY:/opt/local/pgx/cache/}") String cacheDirectory,
		@Value("${PGX_CACHE_MEMORY_SIZE:1000}") long memorySize
	) {
		File directory = new File(cacheDirectory);
		if (!directory.exists() && !directory.mkdirs()) {
			throw new UncheckedIOException(new IOException("Unable to create cache directory " + cacheDirectory));
		}
		this.storage = new ExplanationLog(new File(directory, LOG_FILE_NAME));
		try {
			storage.open();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		this.memory = CacheBuilder.newBuilder()
				.maximumSize(memorySize)
				.build(new CacheLoader<>() {
					@Override
					public Optional<CacheEntry> load(String key) {
						return Optional.ofNullable(storage.get(key));
					}
				});
		log.info("Explanation cache ready in " + directory.getAbsolutePath() + " with " + storage.size() + " entries");
	}

	/**
	 * @throws UncheckedIOException when the backing file cannot be read
	 */
	public Optional<CacheEntry> get(String key) {
		Optional<CacheEntry> entry;
		try {
			entry = memory.getUnchecked(key);
		} catch (UncheckedExecutionException e) {
			if (e.getCause() instanceof RuntimeException) {
				throw (RuntimeException) e.getCause();
			}
			throw e;
		}
		if (entry.isPresent()) {
			hits.incrementAndGet();
		} else {
			// a miss is only remembered until the key is written
			memory.invalidate(key);
			misses.incrementAndGet();
		}
		return entry;
	}

	/**
	 * Stores the entry unless the key is already present.
	 *
	 * @return the stored entry, which is the earlier one when identical content was already present
	 * @throws CacheKeyConflictException when the key holds different content
	 * @throws UncheckedIOException when the entry could not be written
	 */
	public CacheEntry put(String key, CacheEntry entry) {
		if (!key.equals(entry.getKey())) {
			throw new IllegalArgumentException("Entry key " + entry.getKey() + " does not match " + key);
		}
		CacheEntry stored;
		try {
			stored = storage.putIfAbsent(key, entry);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		if (stored == entry) {
			writes.incrementAndGet();
		} else if (!stored.sameContent(entry)) {
			conflicts.incrementAndGet();
			CacheKeyConflictException conflict = new CacheKeyConflictException(key);
			log.error("Refusing to overwrite cached explanation from " + stored.getProvider() + "/" + stored.getModel(), conflict);
			throw conflict;
		}
		memory.put(key, Optional.of(stored));
		return stored;
	}

	public ExplanationCacheStats stats() {
		return new ExplanationCacheStats(storage.size(), hits.get(), misses.get(), writes.get(), conflicts.get());
	}

	@PreDestroy
	public void close() throws IOException {
		storage.close();
	}

	static class ExplanationLog extends FileBackedJsonIndexStorage<String, CacheEntry> {

		private static final TypeReference<CacheEntry> TYPE_REFERENCE = new TypeReference<>() {};

		ExplanationLog(File storageFile) {
			super(storageFile);
		}

		@Override
		protected String keyOf(CacheEntry value) {
			return value.getKey();
		}

		@Override
		public TypeReference<CacheEntry> getTypeReference() {
			return TYPE_REFERENCE;
		}
	}
}
