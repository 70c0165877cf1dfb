package edu.harvard.hms.dbmi.avillach.pgx.processing.job;

import edu.harvard.hms.dbmi.avillach.pgx.data.result.*;
import edu.harvard.hms.dbmi.avillach.pgx.data.rule.DrugRule;
import edu.harvard.hms.dbmi.avillach.pgx.processing.PhenotypeCall;
import edu.harvard.hms.dbmi.avillach.pgx.processing.RiskAssessment;
import edu.harvard.hms.dbmi.avillach.pgx.processing.explanation.DrugExplanation;
import edu.harvard.hms.dbmi.avillach.pgx.processing.generator.ExplanationGenerator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Builds the exported record for a drug that reached a verdict.
 */
@Component
public class ResultRecordFactory {

	public static final String ALGORITHM_VERSION = "CPIC-aligned-v2";

	private final ExplanationGenerator generator;

	@Autowired
	public ResultRecordFactory(ExplanationGenerator generator) {
		this.generator = generator;
	}

	/**
	 * @return the record, or null when the drug has no verdict
	 */
	public ResultRecord create(String patientId, DrugTask task, int genesAnalyzed) {
		RiskAssessment assessment = task.getAssessment();
		if (assessment == null) {
			return null;
		}
		PhenotypeCall call = task.getPhenotypeCall();
		DrugExplanation explanation = task.getExplanation();
		DrugRule rule = assessment.getRule();

		return new ResultRecord(
				patientId,
				task.getDrug(),
				assessment.getAssessedAt().toString(),
				new RiskSummary(
						rule.getRiskLabel().getDisplayName(),
						assessment.getConfidence(),
						rule.getSeverity().getDisplayName(),
						rule.getCategory() == null ? null : rule.getCategory().getDisplayName(),
						call.phenotype().getDisplayName()),
				new GuidelineReference(rule.getEvidenceLevel(), rule.getStrength().getDisplayName(), rule.getCitation()),
				new PharmacogenomicProfile(call.gene(), call.diplotype().getLabel(), call.phenotype().getDisplayName(),
						call.activityScore()),
				new ClinicalRecommendation(rule.getSummary(), rule.getDosing(), rule.getMonitoring()),
				explanation == null ? GeneratedExplanation.empty() : explanation.toGeneratedExplanation(),
				new QualityMetadata(
						explanation == null ? generator.provider() : explanation.getProvider(),
						explanation == null ? generator.model() : explanation.getModel(),
						explanation != null && explanation.isCached(),
						genesAnalyzed,
						ALGORITHM_VERSION)
		);
	}
}
