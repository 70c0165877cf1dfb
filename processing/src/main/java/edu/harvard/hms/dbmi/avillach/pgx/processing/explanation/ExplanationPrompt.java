package edu.harvard.hms.dbmi.avillach.pgx.processing.explanation;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A fully rendered request for one explanation section.
 */
@Value
@Builder
public class ExplanationPrompt {
	PromptTemplate template;
	String systemRole;
	String userText;
	int maxTokens;
	double temperature;
	/** the values substituted into the template, by placeholder name */
	Map<String, String> variables;

	public String getTemplateId() {
		return template.getId();
	}
}
