package edu.harvard.hms.dbmi.avillach.pgx.processing.job;

import edu.harvard.hms.dbmi.avillach.pgx.data.analysis.DiplotypeCall;
import edu.harvard.hms.dbmi.avillach.pgx.data.analysis.DrugOutcome;
import edu.harvard.hms.dbmi.avillach.pgx.data.analysis.DrugState;
import edu.harvard.hms.dbmi.avillach.pgx.data.analysis.FailureStage;
import edu.harvard.hms.dbmi.avillach.pgx.data.genotype.Phenotype;
import edu.harvard.hms.dbmi.avillach.pgx.exception.GeneratorTimeoutException;
import edu.harvard.hms.dbmi.avillach.pgx.processing.TestCatalogs;
import edu.harvard.hms.dbmi.avillach.pgx.processing.explanation.DrugExplanation;
import edu.harvard.hms.dbmi.avillach.pgx.processing.explanation.ExplanationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class DrugAnalysisProcessorTest {

	@Mock
	private ExplanationService explanationService;

	private DrugAnalysisProcessor processor;

	private final Map<String, DiplotypeCall> genotypes = Map.of(
			"cyp2d6", new DiplotypeCall("*1", "*1"),
			"CYP2C9", new DiplotypeCall("*2", "*1"));

	private final DrugExplanation explanation = DrugExplanation.builder()
			.variantInterpretation("v").riskRationale("r").dosingRationale("d").monitoringRationale("m")
			.provider("test").model("model-1").cached(false)
			.build();

	@BeforeEach
	public void setup() {
		processor = new DrugAnalysisProcessor(TestCatalogs.resolver(), TestCatalogs.classifier(), explanationService);
	}

	@Test
	public void verdictAndExplanation() {
		when(explanationService.cached(any(), any())).thenReturn(Optional.empty());
		when(explanationService.explain(any(), any(), any())).thenReturn(explanation);
		DrugTask task = new DrugTask("Codeine");

		processor.process(task, genotypes);

		assertEquals(DrugState.DONE, task.getState());
		assertEquals(DrugOutcome.COMPLETE, task.getOutcome());
		assertEquals(Phenotype.ULTRA_RAPID, task.getPhenotypeCall().phenotype());
		assertSame(explanation, task.getExplanation());
	}

	@Test
	public void fullyCachedExplanationSkipsGeneration() {
		when(explanationService.cached(any(), any())).thenReturn(Optional.of(explanation));
		DrugTask task = new DrugTask("warfarin");

		processor.process(task, genotypes);

		assertEquals(DrugState.DONE, task.getState());
		assertEquals(Phenotype.INTERMEDIATE, task.getAssessment().getPhenotype());
		verify(explanationService, never()).explain(any(), any(), any());
	}

	@Test
	public void missingDiplotypeFailsTheVerdict() {
		DrugTask task = new DrugTask("Clopidogrel");

		processor.process(task, genotypes);

		assertEquals(DrugState.FAILED, task.getState());
		assertEquals(FailureStage.VERDICT, task.getFailureStage());
		assertEquals(DrugOutcome.NO_VERDICT, task.getOutcome());
		assertTrue(task.getFailureReason().contains("CYP2C19"));
		verifyNoInteractions(explanationService);
	}

	@Test
	public void uncoveredDrugFailsTheVerdict() {
		DrugTask task = new DrugTask("Ibuprofen");

		processor.process(task, genotypes);

		assertEquals(FailureStage.VERDICT, task.getFailureStage());
		assertNull(task.getAssessment());
	}

	@Test
	public void generatorFailureKeepsTheVerdict() {
		when(explanationService.cached(any(), any())).thenReturn(Optional.empty());
		when(explanationService.explain(any(), any(), any())).thenThrow(new GeneratorTimeoutException(Duration.ofMillis(20)));
		DrugTask task = new DrugTask("Codeine");

		processor.process(task, genotypes);

		assertEquals(DrugState.FAILED, task.getState());
		assertEquals(FailureStage.EXPLANATION, task.getFailureStage());
		assertEquals(DrugOutcome.VERDICT_ONLY, task.getOutcome());
		assertNotNull(task.getAssessment());
	}

	@Test
	public void cancelledTaskIsLeftAlone() {
		DrugTask task = new DrugTask("Codeine");
		task.fail(FailureStage.CANCELLED, "cancelled");

		processor.process(task, genotypes);

		assertEquals(FailureStage.CANCELLED, task.getFailureStage());
		verifyNoInteractions(explanationService);
	}

	@Test
	public void unexpectedGeneratorFaultKeepsTheVerdict() {
		when(explanationService.cached(any(), any())).thenReturn(Optional.empty());
		when(explanationService.explain(any(), any(), any())).thenThrow(new IllegalStateException("unreadable reply"));
		DrugTask task = new DrugTask("Codeine");

		processor.process(task, genotypes);

		assertEquals(DrugState.FAILED, task.getState());
		assertEquals(FailureStage.EXPLANATION, task.getFailureStage());
		assertEquals(DrugOutcome.VERDICT_ONLY, task.getOutcome());
		assertTrue(task.getFailureReason().contains("unreadable reply"));
	}

	@Test
	public void cacheFaultKeepsTheVerdict() {
		when(explanationService.cached(any(), any())).thenThrow(new IllegalStateException("cache closed"));
		DrugTask task = new DrugTask("Warfarin");

		processor.process(task, genotypes);

		assertEquals(FailureStage.EXPLANATION, task.getFailureStage());
		assertEquals(DrugOutcome.VERDICT_ONLY, task.getOutcome());
	}

	@Test
	public void cancellationWhileExplainingLeavesTheTaskCancelled() {
		DrugTask task = new DrugTask("Codeine");
		when(explanationService.cached(any(), any())).thenReturn(Optional.empty());
		when(explanationService.explain(any(), any(), any())).thenAnswer(invocation -> {
			BooleanSupplier wanted = invocation.getArgument(2);
			assertTrue(wanted.getAsBoolean());
			task.fail(FailureStage.CANCELLED, "cancelled");
			assertFalse(wanted.getAsBoolean());
			throw new CancellationException("no longer wanted");
		});

		processor.process(task, genotypes);

		assertEquals(DrugState.FAILED, task.getState());
		assertEquals(FailureStage.CANCELLED, task.getFailureStage());
		assertEquals("cancelled", task.getFailureReason());
		assertEquals(DrugOutcome.VERDICT_ONLY, task.getOutcome());
	}
}
