package edu.harvard.hms.dbmi.avillach.pgx.processing.explanation;

import edu.harvard.hms.dbmi.avillach.pgx.exception.CacheKeyConflictException;
import edu.harvard.hms.dbmi.avillach.pgx.exception.GeneratorTimeoutException;
import edu.harvard.hms.dbmi.avillach.pgx.exception.GeneratorUnavailableException;
import edu.harvard.hms.dbmi.avillach.pgx.processing.PhenotypeCall;
import edu.harvard.hms.dbmi.avillach.pgx.processing.RiskAssessment;
import edu.harvard.hms.dbmi.avillach.pgx.processing.generator.ExplanationGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Produces the explanation sections for a verdict, reading through the {@link ExplanationCache}.
 *
 * At most one generator call is in flight per cache key across all jobs; concurrent requests
 * for the same key wait for that call and receive its result or its failure. A generated
 * section is written to the cache before it is handed back.
 */
@Service
public class ExplanationService {

	private static final Logger log = LoggerFactory.getLogger(ExplanationService.class);

	private final ExplanationCache cache;

	private final ExplanationGenerator generator;

	private final PromptBuilder promptBuilder;

	private final Duration attemptTimeout;

	private final int maxAttempts;

	private final Duration firstBackoff;

	private final ConcurrentHashMap<String, CompletableFuture<CacheEntry>> inFlight = new ConcurrentHashMap<>();

	private record Section(CacheEntry entry, boolean generated) {
	}

	@Autowired
	public ExplanationService(
		ExplanationCache cache,
		ExplanationGenerator generator,
		PromptBuilder promptBuilder,
		@Value("${pgx.generator.timeout-millis:20000}") long timeoutMillis,
		@Value("${pgx.generator.max-attempts:3}") int maxAttempts,
		@Value("${pgx.generator.backoff-millis:250}") long backoffMillis
	) {
		this.cache = cache;
		this.generator = generator;
		this.promptBuilder = promptBuilder;
		this.attemptTimeout = Duration.ofMillis(timeoutMillis);
		this.maxAttempts = Math.max(1, maxAttempts);
		this.firstBackoff = Duration.ofMillis(backoffMillis);
	}

	public ExplanationGenerator getGenerator() {
		return generator;
	}

	/**
	 * @return the explanation when every section is already cached, otherwise empty
	 */
	public Optional<DrugExplanation> cached(PhenotypeCall call, RiskAssessment assessment) {
		Map<PromptTemplate, String> sections = new EnumMap<>(PromptTemplate.class);
		for (PromptTemplate template : PromptTemplate.values()) {
			Optional<CacheEntry> entry = lookup(keyFor(call, assessment, template));
			if (entry.isEmpty()) {
				return Optional.empty();
			}
			sections.put(template, entry.get().getText());
		}
		return Optional.of(DrugExplanation.of(sections, generator.provider(), generator.model(), true));
	}

	/**
	 * Returns all four sections, generating the ones not yet cached.
	 *
	 * @throws GeneratorUnavailableException or {@link GeneratorTimeoutException} when a section
	 *         could not be generated within the retry budget
	 */
	public DrugExplanation explain(PhenotypeCall call, RiskAssessment assessment) {
		return explain(call, assessment, () -> true);
	}

	/**
	 * As {@link #explain(PhenotypeCall, RiskAssessment)}, but checks {@code wanted} before each
	 * section that still has to be generated. Sections generated before it turned false stay cached.
	 *
	 * @throws CancellationException once {@code wanted} returns false
	 */
	public DrugExplanation explain(PhenotypeCall call, RiskAssessment assessment, BooleanSupplier wanted) {
		Map<PromptTemplate, String> sections = new EnumMap<>(PromptTemplate.class);
		boolean generatedAny = false;
		for (PromptTemplate template : PromptTemplate.values()) {
			String key = keyFor(call, assessment, template);
			Optional<CacheEntry> cachedEntry = lookup(key);
			if (cachedEntry.isPresent()) {
				sections.put(template, cachedEntry.get().getText());
				continue;
			}
			if (!wanted.getAsBoolean()) {
				throw new CancellationException("Explanation of " + assessment.getDrug() + " is no longer wanted");
			}
			Section section = generateOnce(key, () -> promptBuilder.build(template, call, assessment));
			sections.put(template, section.entry().getText());
			generatedAny |= section.generated();
		}
		return DrugExplanation.of(sections, generator.provider(), generator.model(), !generatedAny);
	}

	private String keyFor(PhenotypeCall call, RiskAssessment assessment, PromptTemplate template) {
		return ExplanationCacheKey.of(call, assessment, template, generator.versionTag());
	}

	private Optional<CacheEntry> lookup(String key) {
		try {
			return cache.get(key);
		} catch (UncheckedIOException e) {
			log.warn("Unable to read cached explanation " + key + ", treating it as missing", e);
			return Optional.empty();
		}
	}

	private Section generateOnce(String key, Supplier<ExplanationPrompt> prompt) {
		CompletableFuture<CacheEntry> mine = new CompletableFuture<>();
		CompletableFuture<CacheEntry> owner = inFlight.putIfAbsent(key, mine);
		if (owner != null) {
			return new Section(await(owner), false);
		}
		try {
			// the previous owner may have finished between our cache miss and taking the slot
			Optional<CacheEntry> stored = lookup(key);
			if (stored.isPresent()) {
				mine.complete(stored.get());
				return new Section(stored.get(), false);
			}
			CacheEntry entry = store(key, generate(prompt.get()));
			mine.complete(entry);
			return new Section(entry, true);
		} catch (RuntimeException e) {
			mine.completeExceptionally(e);
			throw e;
		} finally {
			inFlight.remove(key, mine);
		}
	}

	private static CacheEntry await(CompletableFuture<CacheEntry> future) {
		try {
			return future.join();
		} catch (CompletionException e) {
			if (e.getCause() instanceof RuntimeException) {
				throw (RuntimeException) e.getCause();
			}
			throw e;
		}
	}

	private String generate(ExplanationPrompt prompt) {
		long startTime = System.currentTimeMillis();
		String text = Mono.defer(() -> generator.generate(prompt))
				.switchIfEmpty(Mono.error(() -> new GeneratorUnavailableException("Explanation generator returned nothing", false)))
				.timeout(attemptTimeout)
				.onErrorMap(TimeoutException.class, e -> new GeneratorTimeoutException(attemptTimeout))
				.retryWhen(Retry.backoff(maxAttempts - 1, firstBackoff)
						.filter(ExplanationService::isRetryable)
						.doBeforeRetry(signal -> log.warn("Generating " + prompt.getTemplateId() + " failed on attempt "
								+ (signal.totalRetries() + 1) + " of " + maxAttempts + ": " + signal.failure().getMessage()))
						.onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
				.block();
		log.debug("Generated " + prompt.getTemplateId() + " in " + (System.currentTimeMillis() - startTime) + "ms");
		return text;
	}

	static boolean isRetryable(Throwable e) {
		if (e instanceof GeneratorTimeoutException) {
			return true;
		}
		return e instanceof GeneratorUnavailableException && ((GeneratorUnavailableException) e).isRetryable();
	}

	private CacheEntry store(String key, String text) {
		CacheEntry entry = CacheEntry.builder()
				.key(key)
				.text(text)
				.provider(generator.provider())
				.model(generator.model())
				.createdAt(System.currentTimeMillis())
				.build();
		try {
			return cache.put(key, entry);
		} catch (CacheKeyConflictException e) {
			return lookup(key).orElse(entry);
		} catch (UncheckedIOException e) {
			log.warn("Unable to persist explanation " + key + ", returning it uncached", e);
			return entry;
		}
	}
}
