package edu.harvard.hms.dbmi.avillach.pgx.processing.explanation;

import edu.harvard.hms.dbmi.avillach.pgx.data.result.GeneratedExplanation;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * The four explanation sections for one drug verdict.
 */
@Value
@Builder
public class DrugExplanation {
	String variantInterpretation;
	String riskRationale;
	String dosingRationale;
	String monitoringRationale;
	String provider;
	String model;
	/** true when every section came from the cache rather than a generator call made for this request */
	boolean cached;

	static DrugExplanation of(Map<PromptTemplate, String> sections, String provider, String model, boolean cached) {
		return DrugExplanation.builder()
				.variantInterpretation(sections.get(PromptTemplate.VARIANT_EXPLANATION))
				.riskRationale(sections.get(PromptTemplate.RISK_EXPLANATION))
				.dosingRationale(sections.get(PromptTemplate.DOSING_ADJUSTMENT))
				.monitoringRationale(sections.get(PromptTemplate.MONITORING_GUIDANCE))
				.provider(provider)
				.model(model)
				.cached(cached)
				.build();
	}

	public GeneratedExplanation toGeneratedExplanation() {
		return new GeneratedExplanation(variantInterpretation, riskRationale, dosingRationale, monitoringRationale,
				provider + "/" + model);
	}
}
