package edu.harvard.hms.dbmi.avillach.pgx.processing.explanation;

/**
 * The four explanation sections written for every drug verdict. Each template carries the
 * generation settings used for its section. Placeholders are written as {@code {name}} and
 * filled by {@link PromptBuilder}.
 */
public enum PromptTemplate {

	VARIANT_EXPLANATION(
			"variant_explanation",
			"You are a genetics expert specializing in pharmacogenomics. Explain complex genetic information in patient-friendly terms.",
			"Explain the genetic profile for the '{gene}' gene:\n"
					+ "- Diplotype: {diplotype}\n"
					+ "- Phenotype: {phenotype}\n"
					+ "- Activity Score: {activity_score}\n\n"
					+ "Provide a clear explanation that includes:\n"
					+ "1. What this diplotype means (in simple terms)\n"
					+ "2. How the activity score relates to the phenotype\n"
					+ "3. General implications for drug metabolism\n\n"
					+ "Keep to 120-150 words. Use patient-friendly language.",
			180, 0.5),

	RISK_EXPLANATION(
			"risk_explanation",
			"You are an expert pharmacogenomics assistant. Provide clear, accurate, and clinically relevant explanations. Avoid jargon where possible.",
			"Explain the pharmacogenomic risk for drug-gene interaction:\n\n"
					+ "Drug: {drug}\n"
					+ "Gene: {gene}\n"
					+ "Phenotype: {phenotype}\n"
					+ "Risk Level: {risk_level} ({severity} severity, {category})\n"
					+ "Clinical Context: {clinical_guidance}\n\n"
					+ "Provide:\n"
					+ "1. Clear summary of the interaction and why it matters\n"
					+ "2. Specific impact of the '{phenotype}' phenotype on {drug} metabolism\n"
					+ "3. Why this is classified as '{risk_level}' risk\n"
					+ "4. Key patient safety points\n\n"
					+ "Keep under 180 words. Use clear, medical but accessible language.",
			250, 0.6),

	DOSING_ADJUSTMENT(
			"dosing_adjustment",
			"You are a clinical pharmacist expert in pharmacogenomics. Provide safe, evidence-based dosing recommendations.",
			"Provide dosing guidance based on pharmacogenomics:\n\n"
					+ "Drug: {drug}\n"
					+ "Patient Phenotype: {phenotype}\n"
					+ "Gene: {gene}\n"
					+ "Guideline Dosing: {dosing}\n"
					+ "Risk Assessment: {risk_level}\n\n"
					+ "Explain:\n"
					+ "1. How the phenotype affects drug metabolism\n"
					+ "2. The recommended dose adjustment, if any\n"
					+ "3. Key warning signs to watch for\n\n"
					+ "Keep under 200 words. Emphasize safety.",
			220, 0.4),

	MONITORING_GUIDANCE(
			"monitoring_guidance",
			"You are a clinical pharmacist expert in pharmacogenomics. Provide practical, evidence-based monitoring advice.",
			"Describe how to monitor a patient on {drug}:\n\n"
					+ "Gene: {gene}\n"
					+ "Patient Phenotype: {phenotype}\n"
					+ "Risk Assessment: {risk_level}\n"
					+ "Guideline Monitoring: {monitoring}\n\n"
					+ "Explain what to measure, how often, and which findings should prompt a change of therapy.\n\n"
					+ "Keep under 150 words.",
			200, 0.4);

	private final String id;
	private final String systemRole;
	private final String userTemplate;
	private final int maxTokens;
	private final double temperature;

	PromptTemplate(String id, String systemRole, String userTemplate, int maxTokens, double temperature) {
		this.id = id;
		this.systemRole = systemRole;
		this.userTemplate = userTemplate;
		this.maxTokens = maxTokens;
		this.temperature = temperature;
	}

	public String getId() {
		return id;
	}

	public String getSystemRole() {
		return systemRole;
	}

	public String getUserTemplate() {
		return userTemplate;
	}

	public int getMaxTokens() {
		return maxTokens;
	}

	public double getTemperature() {
		return temperature;
	}
}
