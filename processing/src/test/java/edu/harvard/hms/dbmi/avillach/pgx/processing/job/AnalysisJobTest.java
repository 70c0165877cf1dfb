package edu.harvard.hms.dbmi.avillach.pgx.processing.job;

import com.google.common.util.concurrent.MoreExecutors;
import edu.harvard.hms.dbmi.avillach.pgx.data.analysis.*;
import edu.harvard.hms.dbmi.avillach.pgx.data.result.ResultRecord;
import edu.harvard.hms.dbmi.avillach.pgx.exception.GeneratorUnavailableException;
import edu.harvard.hms.dbmi.avillach.pgx.processing.TestCatalogs;
import edu.harvard.hms.dbmi.avillach.pgx.processing.explanation.ExplanationCache;
import edu.harvard.hms.dbmi.avillach.pgx.processing.explanation.ExplanationService;
import edu.harvard.hms.dbmi.avillach.pgx.processing.explanation.PromptBuilder;
import edu.harvard.hms.dbmi.avillach.pgx.processing.generator.ExplanationGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class AnalysisJobTest {

	@Mock
	private ExplanationService explanationService;

	@Mock
	private ExplanationGenerator generator;

	private DrugAnalysisProcessor processor;

	private ResultRecordFactory resultRecordFactory;

	private final ExecutorService direct = MoreExecutors.newDirectExecutorService();

	private final AnalysisRequest request = new AnalysisRequest("PATIENT_001",
			Map.of("CYP2D6", new DiplotypeCall("*1", "*1"), "CYP2C9", new DiplotypeCall("*1", "*2")),
			List.of("Codeine", "Warfarin", "Clopidogrel"));

	@BeforeEach
	public void setup() {
		lenient().when(generator.provider()).thenReturn("test");
		lenient().when(generator.model()).thenReturn("model-1");
		processor = new DrugAnalysisProcessor(TestCatalogs.resolver(), TestCatalogs.classifier(), explanationService);
		resultRecordFactory = new ResultRecordFactory(generator);
	}

	private AnalysisJob newJob() {
		return new AnalysisJob("job-1", request, processor, resultRecordFactory)
				.setQueuedTime(System.currentTimeMillis())
				.setJobQueue(direct)
				.setDrugQueue(direct);
	}

	@Test
	public void failingGeneratorStillCompletesTheJobWithVerdicts() {
		when(explanationService.cached(any(), any())).thenReturn(Optional.empty());
		when(explanationService.explain(any(), any(), any())).thenThrow(new GeneratorUnavailableException("down", true));
		AtomicInteger notified = new AtomicInteger();
		AnalysisJob job = newJob().setCompletionListener(finished -> notified.incrementAndGet());

		job.run();

		assertEquals(JobState.COMPLETED, job.getState());
		assertEquals(1, notified.get());
		AnalysisResult result = job.toResult();
		assertEquals(3, result.drugs().size());

		DrugStatus codeine = result.drugs().get(0);
		assertEquals(DrugState.FAILED, codeine.state());
		assertEquals(FailureStage.EXPLANATION, codeine.failureStage());
		assertEquals(DrugOutcome.VERDICT_ONLY, codeine.outcome());
		ResultRecord record = codeine.result();
		assertEquals("High", record.riskAssessment().riskLabel());
		assertEquals("critical", record.riskAssessment().severity());
		assertEquals("Toxic", record.riskAssessment().category());
		assertTrue(record.clinicalRecommendation().dosing().startsWith("Avoid codeine"));
		assertEquals("", record.generatedExplanation().riskRationale());
		assertEquals(2, record.qualityMetadata().genesAnalyzed());
		assertEquals(ResultRecordFactory.ALGORITHM_VERSION, record.qualityMetadata().algorithmVersion());

		DrugStatus warfarin = result.drugs().get(1);
		assertTrue(warfarin.result().clinicalRecommendation().dosing().contains("Reduce the initial dose by 30-40%"));

		DrugStatus clopidogrel = result.drugs().get(2);
		assertEquals(FailureStage.VERDICT, clopidogrel.failureStage());
		assertEquals(DrugOutcome.NO_VERDICT, clopidogrel.outcome());
		assertNull(clopidogrel.result());
	}

	@Test
	public void detailsStayHiddenUntilTheJobFinishes() {
		AnalysisJob job = newJob();

		AnalysisStatus status = job.toStatus();

		assertEquals(JobState.QUEUED, status.state());
		assertNull(job.toResult());
		for (DrugStatus drug : status.drugs()) {
			assertEquals(DrugState.PENDING, drug.state());
			assertNull(drug.outcome());
			assertNull(drug.result());
		}
	}

	@Test
	public void cancellingAQueuedJob() {
		AnalysisJob job = newJob();

		assertTrue(job.cancel());
		job.run();

		assertEquals(JobState.COMPLETED, job.getState());
		assertTrue(job.isCancelled());
		for (DrugStatus drug : job.toResult().drugs()) {
			assertEquals(DrugState.FAILED, drug.state());
			assertEquals(FailureStage.CANCELLED, drug.failureStage());
			assertEquals("cancelled", drug.failureReason());
		}
		assertFalse(job.cancel());
		verifyNoInteractions(explanationService);
	}

	@Test
	public void rejectedJobFails() {
		ExecutorService stopped = MoreExecutors.newDirectExecutorService();
		stopped.shutdown();
		AnalysisJob job = newJob().setJobQueue(stopped);

		job.enqueue();

		assertEquals(JobState.FAILED, job.getState());
		for (DrugStatus drug : job.toResult().drugs()) {
			assertEquals(FailureStage.ORCHESTRATION, drug.failureStage());
		}
	}

	@Test
	public void unexpectedExplanationFaultFailsOnlyThatStage() {
		when(explanationService.cached(any(), any())).thenThrow(new IllegalStateException("boom"));
		AnalysisJob job = newJob();

		job.run();

		assertEquals(JobState.COMPLETED, job.getState());
		List<DrugStatus> drugs = job.toResult().drugs();
		assertEquals(FailureStage.EXPLANATION, drugs.get(0).failureStage());
		assertEquals(DrugOutcome.VERDICT_ONLY, drugs.get(0).outcome());
		assertEquals(FailureStage.EXPLANATION, drugs.get(1).failureStage());
		assertEquals(DrugOutcome.VERDICT_ONLY, drugs.get(1).outcome());
	}

	@Test
	public void faultInOneDrugLeavesItsSiblingsAlone() {
		when(explanationService.cached(any(), any())).thenReturn(Optional.empty());
		when(explanationService.explain(any(), any(), any())).thenThrow(new GeneratorUnavailableException("down", false));
		DrugAnalysisProcessor breaksOnWarfarin = new DrugAnalysisProcessor(TestCatalogs.resolver(), TestCatalogs.classifier(), explanationService) {
			@Override
			public void process(DrugTask task, Map<String, DiplotypeCall> genotypes) {
				if (task.getDrug().equals("Warfarin")) {
					throw new IllegalStateException("worker fault");
				}
				super.process(task, genotypes);
			}
		};
		AnalysisJob job = new AnalysisJob("job-2", request, breaksOnWarfarin, resultRecordFactory)
				.setQueuedTime(System.currentTimeMillis())
				.setJobQueue(direct)
				.setDrugQueue(direct);

		job.run();

		assertEquals(JobState.COMPLETED, job.getState());
		List<DrugStatus> drugs = job.toResult().drugs();
		assertEquals(FailureStage.EXPLANATION, drugs.get(0).failureStage());
		assertEquals(DrugOutcome.VERDICT_ONLY, drugs.get(0).outcome());
		assertEquals(FailureStage.ORCHESTRATION, drugs.get(1).failureStage());
		assertEquals("worker fault", drugs.get(1).failureReason());
		assertEquals(FailureStage.VERDICT, drugs.get(2).failureStage());
	}

	@Test
	public void cancellingARunningJobKeepsWrittenCacheEntries(@TempDir Path cacheDirectory) throws InterruptedException, IOException {
		lenient().when(generator.versionTag()).thenReturn("test/model-1");
		CountDownLatch generating = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		when(generator.generate(any())).thenAnswer(invocation -> {
			generating.countDown();
			release.await(5, TimeUnit.SECONDS);
			return Mono.just("first section");
		});
		ExplanationCache cache = new ExplanationCache(cacheDirectory.toString(), 100);
		ExplanationService realExplanations = new ExplanationService(cache, generator, new PromptBuilder(), 10000, 1, 1);
		DrugAnalysisProcessor realProcessor = new DrugAnalysisProcessor(TestCatalogs.resolver(), TestCatalogs.classifier(), realExplanations);
		ExecutorService jobPool = Executors.newSingleThreadExecutor();
		ExecutorService drugPool = Executors.newSingleThreadExecutor();
		AtomicInteger notified = new AtomicInteger();
		AnalysisJob job = new AnalysisJob("job-3", request, realProcessor, resultRecordFactory)
				.setQueuedTime(System.currentTimeMillis())
				.setJobQueue(jobPool)
				.setDrugQueue(drugPool)
				.setCompletionListener(finished -> notified.incrementAndGet());

		try {
			job.enqueue();
			assertTrue(generating.await(5, TimeUnit.SECONDS));
			assertEquals(DrugState.EXPLAINING, job.getDrugTasks().get(0).getState());
			assertEquals(DrugState.PENDING, job.getDrugTasks().get(1).getState());

			assertTrue(job.cancel());
			AnalysisStatus cancelled = job.toStatus();
			release.countDown();
			jobPool.shutdown();
			drugPool.shutdown();
			assertTrue(jobPool.awaitTermination(5, TimeUnit.SECONDS));
			assertTrue(drugPool.awaitTermination(5, TimeUnit.SECONDS));

			assertEquals(JobState.COMPLETED, job.getState());
			assertTrue(job.isCancelled());
			assertEquals(1, notified.get());
			assertEquals(cancelled, job.toStatus());
			for (DrugStatus drug : job.toResult().drugs()) {
				assertEquals(DrugState.FAILED, drug.state());
				assertEquals(FailureStage.CANCELLED, drug.failureStage());
				assertEquals("cancelled", drug.failureReason());
			}
			assertEquals(DrugOutcome.VERDICT_ONLY, job.toResult().drugs().get(0).outcome());
			// the section generated before the cancel stays cached, nothing after it was generated
			verify(generator, times(1)).generate(any());
			assertEquals(1, cache.stats().entries());
		} finally {
			release.countDown();
			jobPool.shutdownNow();
			drugPool.shutdownNow();
			cache.close();
		}
	}
}
