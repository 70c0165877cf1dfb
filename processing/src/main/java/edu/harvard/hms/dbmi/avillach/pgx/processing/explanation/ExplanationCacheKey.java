package edu.harvard.hms.dbmi.avillach.pgx.processing.explanation;

import com.google.common.hash.Hashing;
import edu.harvard.hms.dbmi.avillach.pgx.data.genotype.AlleleCatalog;
import edu.harvard.hms.dbmi.avillach.pgx.data.rule.DrugRule;
import edu.harvard.hms.dbmi.avillach.pgx.data.rule.RuleTable;
import edu.harvard.hms.dbmi.avillach.pgx.processing.PhenotypeCall;
import edu.harvard.hms.dbmi.avillach.pgx.processing.RiskAssessment;

import java.nio.charset.StandardCharsets;

/**
 * Content address of one explanation section: a SHA-256 hex digest over every input that
 * changes the generated text, including the generator that writes it.
 */
public final class ExplanationCacheKey {

	private static final String FIELD_SEPARATOR = "\u001F";

	private ExplanationCacheKey() {
	}

	public static String of(PhenotypeCall call, RiskAssessment assessment, PromptTemplate template, String versionTag) {
		DrugRule rule = assessment.getRule();
		String canonical = String.join(FIELD_SEPARATOR,
				AlleleCatalog.normalizeGene(call.gene()),
				call.diplotype().getLabel(),
				call.phenotype().name(),
				RuleTable.normalizeDrug(assessment.getDrug()),
				rule.getRiskLabel().name(),
				rule.getSeverity().name(),
				rule.getCategory() == null ? "" : rule.getCategory().name(),
				template.getId(),
				versionTag);
		return Hashing.sha256().hashString(canonical, StandardCharsets.UTF_8).toString();
	}
}
