package edu.harvard.hms.dbmi.avillach.pgx.processing.explanation;

import com.google.common.collect.ImmutableMap;
import edu.harvard.hms.dbmi.avillach.pgx.data.rule.DrugRule;
import edu.harvard.hms.dbmi.avillach.pgx.processing.PhenotypeCall;
import edu.harvard.hms.dbmi.avillach.pgx.processing.RiskAssessment;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class PromptBuilder {

	private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");

	public ExplanationPrompt build(PromptTemplate template, PhenotypeCall call, RiskAssessment assessment) {
		Map<String, String> variables = variables(call, assessment);
		return ExplanationPrompt.builder()
				.template(template)
				.systemRole(template.getSystemRole())
				.userText(render(template.getUserTemplate(), variables))
				.maxTokens(template.getMaxTokens())
				.temperature(template.getTemperature())
				.variables(variables)
				.build();
	}

	public Map<String, String> variables(PhenotypeCall call, RiskAssessment assessment) {
		DrugRule rule = assessment.getRule();
		return ImmutableMap.<String, String>builder()
				.put("gene", call.gene())
				.put("diplotype", call.diplotype().getLabel())
				.put("phenotype", call.phenotype().getDisplayName())
				.put("activity_score", call.activityScore() == null ? "not determinable"
						: String.format(Locale.ENGLISH, "%.2f", call.activityScore()))
				.put("drug", assessment.getDrug())
				.put("risk_level", rule.getRiskLabel().getDisplayName())
				.put("severity", rule.getSeverity().getDisplayName())
				.put("category", rule.getCategory() == null ? "" : rule.getCategory().getDisplayName())
				.put("clinical_guidance", nullToEmpty(rule.getSummary()))
				.put("dosing", nullToEmpty(rule.getDosing()))
				.put("monitoring", nullToEmpty(rule.getMonitoring()))
				.build();
	}

	static String render(String template, Map<String, String> variables) {
		Matcher matcher = PLACEHOLDER.matcher(template);
		StringBuilder rendered = new StringBuilder();
		while (matcher.find()) {
			String value = variables.get(matcher.group(1));
			if (value == null) {
				throw new IllegalArgumentException("No value for prompt placeholder {" + matcher.group(1) + "}");
			}
			matcher.appendReplacement(rendered, Matcher.quoteReplacement(value));
		}
		matcher.appendTail(rendered);
		return rendered.toString();
	}

	private static String nullToEmpty(String value) {
		return value == null ? "" : value;
	}
}
