package edu.harvard.hms.dbmi.avillach.pgx.processing.explanation;

import edu.harvard.hms.dbmi.avillach.pgx.exception.GeneratorTimeoutException;
import edu.harvard.hms.dbmi.avillach.pgx.exception.GeneratorUnavailableException;
import edu.harvard.hms.dbmi.avillach.pgx.processing.PhenotypeCall;
import edu.harvard.hms.dbmi.avillach.pgx.processing.RiskAssessment;
import edu.harvard.hms.dbmi.avillach.pgx.processing.TestCatalogs;
import edu.harvard.hms.dbmi.avillach.pgx.processing.generator.ExplanationGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class ExplanationServiceTest {

	@TempDir
	Path cacheDirectory;

	@Mock
	private ExplanationGenerator generator;

	private ExplanationCache cache;

	private PhenotypeCall call;

	private RiskAssessment assessment;

	@BeforeEach
	public void setup() {
		lenient().when(generator.provider()).thenReturn("test");
		lenient().when(generator.model()).thenReturn("model-1");
		lenient().when(generator.versionTag()).thenReturn("test/model-1");
		cache = new ExplanationCache(cacheDirectory.toString(), 100);
		call = TestCatalogs.resolver().call("CYP2D6", "*1", "*1");
		assessment = TestCatalogs.classifier().classify(call.gene(), call.phenotype(), "Codeine");
	}

	@AfterEach
	public void close() throws IOException {
		cache.close();
	}

	private ExplanationService service(int maxAttempts, long timeoutMillis) {
		return new ExplanationService(cache, generator, new PromptBuilder(), timeoutMillis, maxAttempts, 1);
	}

	private static Mono<String> textFor(ExplanationPrompt prompt) {
		return Mono.just("text for " + prompt.getTemplateId());
	}

	@Test
	public void generatesEachSectionOnceThenServesFromCache() {
		when(generator.generate(any())).thenAnswer(invocation -> textFor(invocation.getArgument(0)));
		ExplanationService service = service(3, 1000);

		assertTrue(service.cached(call, assessment).isEmpty());
		DrugExplanation first = service.explain(call, assessment);
		assertFalse(first.isCached());
		assertEquals("text for risk_explanation", first.getRiskRationale());
		assertEquals("text for monitoring_guidance", first.getMonitoringRationale());

		DrugExplanation second = service.explain(call, assessment);
		assertTrue(second.isCached());
		assertEquals(first.getVariantInterpretation(), second.getVariantInterpretation());
		assertTrue(service.cached(call, assessment).isPresent());

		verify(generator, times(PromptTemplate.values().length)).generate(any());
		assertEquals(4, cache.stats().entries());
	}

	@Test
	public void retryableFailureIsRetried() {
		AtomicInteger calls = new AtomicInteger();
		when(generator.generate(any())).thenAnswer(invocation -> {
			if (calls.getAndIncrement() == 0) {
				return Mono.error(new GeneratorUnavailableException("503", true));
			}
			return textFor(invocation.getArgument(0));
		});

		DrugExplanation explanation = service(3, 1000).explain(call, assessment);

		assertEquals("text for variant_explanation", explanation.getVariantInterpretation());
		assertEquals(5, calls.get());
	}

	@Test
	public void nonRetryableFailureIsNotRetried() {
		when(generator.generate(any())).thenReturn(Mono.error(new GeneratorUnavailableException("400", false)));

		assertThrows(GeneratorUnavailableException.class, () -> service(3, 1000).explain(call, assessment));
		verify(generator, times(1)).generate(any());
		assertEquals(0, cache.stats().entries());
	}

	@Test
	public void retryBudgetIsBounded() {
		when(generator.generate(any())).thenReturn(Mono.error(new GeneratorUnavailableException("503", true)));

		GeneratorUnavailableException e = assertThrows(GeneratorUnavailableException.class,
				() -> service(3, 1000).explain(call, assessment));
		assertTrue(e.isRetryable());
		verify(generator, times(3)).generate(any());
	}

	@Test
	public void slowGeneratorTimesOut() {
		when(generator.generate(any())).thenReturn(Mono.never());

		assertThrows(GeneratorTimeoutException.class, () -> service(2, 50).explain(call, assessment));
		verify(generator, times(2)).generate(any());
	}

	@Test
	public void concurrentRequestsShareOneGeneratorCall() throws Exception {
		CountDownLatch release = new CountDownLatch(1);
		AtomicInteger calls = new AtomicInteger();
		when(generator.generate(any())).thenAnswer(invocation -> {
			calls.incrementAndGet();
			ExplanationPrompt prompt = invocation.getArgument(0);
			return Mono.fromCallable(() -> {
				release.await(5, TimeUnit.SECONDS);
				return "shared " + prompt.getTemplateId();
			});
		});
		ExplanationService service = service(1, 10_000);

		int requests = 6;
		ExecutorService pool = Executors.newFixedThreadPool(requests);
		List<Future<DrugExplanation>> futures = new ArrayList<>();
		for (int i = 0; i < requests; i++) {
			futures.add(pool.submit(() -> service.explain(call, assessment)));
		}
		Thread.sleep(500);
		release.countDown();

		int generatedByThisRequest = 0;
		for (Future<DrugExplanation> future : futures) {
			DrugExplanation explanation = future.get(10, TimeUnit.SECONDS);
			assertEquals("shared risk_explanation", explanation.getRiskRationale());
			if (!explanation.isCached()) {
				generatedByThisRequest++;
			}
		}
		pool.shutdown();

		assertEquals(PromptTemplate.values().length, calls.get());
		assertTrue(generatedByThisRequest >= 1);
	}

	@Test
	public void sharedFailureReachesEveryWaiter() throws Exception {
		CountDownLatch release = new CountDownLatch(1);
		when(generator.generate(any())).thenAnswer(invocation -> Mono.fromCallable(() -> {
			release.await(5, TimeUnit.SECONDS);
			throw new GeneratorUnavailableException("down", false);
		}));
		ExplanationService service = service(1, 10_000);

		ExecutorService pool = Executors.newFixedThreadPool(3);
		List<Future<DrugExplanation>> futures = new ArrayList<>();
		for (int i = 0; i < 3; i++) {
			futures.add(pool.submit(() -> service.explain(call, assessment)));
		}
		Thread.sleep(500);
		release.countDown();

		for (Future<DrugExplanation> future : futures) {
			ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
			assertInstanceOf(GeneratorUnavailableException.class, e.getCause());
		}
		pool.shutdown();
		verify(generator, times(1)).generate(any());
	}
}
