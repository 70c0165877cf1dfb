package edu.harvard.hms.dbmi.avillach.pgx.processing.job;

import edu.harvard.hms.dbmi.avillach.pgx.data.analysis.DiplotypeCall;
import edu.harvard.hms.dbmi.avillach.pgx.data.analysis.DrugState;
import edu.harvard.hms.dbmi.avillach.pgx.data.analysis.FailureStage;
import edu.harvard.hms.dbmi.avillach.pgx.data.genotype.AlleleCatalog;
import edu.harvard.hms.dbmi.avillach.pgx.exception.GeneratorTimeoutException;
import edu.harvard.hms.dbmi.avillach.pgx.exception.GeneratorUnavailableException;
import edu.harvard.hms.dbmi.avillach.pgx.exception.InvalidGenotypeException;
import edu.harvard.hms.dbmi.avillach.pgx.exception.RuleNotFoundException;
import edu.harvard.hms.dbmi.avillach.pgx.processing.DiplotypeResolver;
import edu.harvard.hms.dbmi.avillach.pgx.processing.PhenotypeCall;
import edu.harvard.hms.dbmi.avillach.pgx.processing.RiskAssessment;
import edu.harvard.hms.dbmi.avillach.pgx.processing.RiskClassifier;
import edu.harvard.hms.dbmi.avillach.pgx.processing.explanation.DrugExplanation;
import edu.harvard.hms.dbmi.avillach.pgx.processing.explanation.ExplanationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Runs a single drug from PENDING to a terminal state: verdict first, then the explanation.
 * An explanation failure keeps the verdict. If the task is cancelled part way, the next
 * refused transition ends the processing.
 */
@Component
public class DrugAnalysisProcessor {

	private static final Logger log = LoggerFactory.getLogger(DrugAnalysisProcessor.class);

	private final DiplotypeResolver resolver;
	private final RiskClassifier classifier;
	private final ExplanationService explanationService;

	@Autowired
	public DrugAnalysisProcessor(DiplotypeResolver resolver, RiskClassifier classifier, ExplanationService explanationService) {
		this.resolver = resolver;
		this.classifier = classifier;
		this.explanationService = explanationService;
	}

	public void process(DrugTask task, Map<String, DiplotypeCall> genotypes) {
		if (!task.advance(DrugState.RESOLVING)) {
			return;
		}
		PhenotypeCall call;
		RiskAssessment assessment;
		try {
			String gene = classifier.geneFor(task.getDrug());
			DiplotypeCall diplotype = findGenotype(genotypes, gene);
			if (diplotype == null) {
				task.fail(FailureStage.VERDICT, "No diplotype supplied for " + gene + ", which governs " + task.getDrug());
				return;
			}
			call = resolver.call(gene, diplotype.allele1(), diplotype.allele2());
			assessment = classifier.classify(call.gene(), call.phenotype(), task.getDrug());
		} catch (RuleNotFoundException | InvalidGenotypeException e) {
			task.fail(FailureStage.VERDICT, e.getMessage());
			return;
		}
		if (!task.recordVerdict(call, assessment)) {
			return;
		}

		try {
			Optional<DrugExplanation> cached = explanationService.cached(call, assessment);
			if (cached.isPresent()) {
				task.complete(cached.get());
				return;
			}
			if (!task.advance(DrugState.EXPLAINING)) {
				return;
			}
			task.complete(explanationService.explain(call, assessment, () -> !task.isTerminal()));
		} catch (CancellationException e) {
			log.info("Stopped explaining " + task.getDrug() + " after it was cancelled");
		} catch (GeneratorUnavailableException | GeneratorTimeoutException e) {
			log.warn("Explanation for " + task.getDrug() + " failed, keeping the verdict only: " + e.getMessage());
			task.fail(FailureStage.EXPLANATION, e.getMessage());
		} catch (RuntimeException e) {
			log.error("Explanation for " + task.getDrug() + " failed unexpectedly, keeping the verdict only", e);
			task.fail(FailureStage.EXPLANATION, e.getClass().getSimpleName() + ": " + e.getMessage());
		}
	}

	private static DiplotypeCall findGenotype(Map<String, DiplotypeCall> genotypes, String gene) {
		for (Map.Entry<String, DiplotypeCall> entry : genotypes.entrySet()) {
			if (AlleleCatalog.normalizeGene(entry.getKey()).equals(gene)) {
				return entry.getValue();
			}
		}
		return null;
	}
}
