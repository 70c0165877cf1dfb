package edu.harvard.hms.dbmi.avillach.pgx.processing.explanation;

import edu.harvard.hms.dbmi.avillach.pgx.processing.PhenotypeCall;
import edu.harvard.hms.dbmi.avillach.pgx.processing.RiskAssessment;
import edu.harvard.hms.dbmi.avillach.pgx.processing.TestCatalogs;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PromptBuilderTest {

	private final PromptBuilder promptBuilder = new PromptBuilder();

	@Test
	public void everyTemplateRendersCompletely() {
		PhenotypeCall call = TestCatalogs.resolver().call("CYP2C9", "*2", "*1");
		RiskAssessment assessment = TestCatalogs.classifier().classify(call.gene(), call.phenotype(), "Warfarin");

		for (PromptTemplate template : PromptTemplate.values()) {
			ExplanationPrompt prompt = promptBuilder.build(template, call, assessment);
			assertFalse(prompt.getUserText().matches("(?s).*\\{[a-z_]+}.*"), template + " left a placeholder");
			assertEquals(template.getSystemRole(), prompt.getSystemRole());
			assertEquals(template.getMaxTokens(), prompt.getMaxTokens());
		}
		ExplanationPrompt dosing = promptBuilder.build(PromptTemplate.DOSING_ADJUSTMENT, call, assessment);
		assertTrue(dosing.getUserText().contains("Reduce the initial dose by 30-40%"));
		assertEquals("*1/*2", dosing.getVariables().get("diplotype"));
		assertEquals("1.50", dosing.getVariables().get("activity_score"));
	}

	@Test
	public void indeterminateCallHasNoScore() {
		PhenotypeCall call = TestCatalogs.resolver().call("CYP2D6", "*22", "*1");
		RiskAssessment assessment = TestCatalogs.classifier().classify(call.gene(), call.phenotype(), "Codeine");
		assertEquals("not determinable", promptBuilder.variables(call, assessment).get("activity_score"));
	}

	@Test
	public void unknownPlaceholderIsRejected() {
		assertEquals("a b", PromptBuilder.render("{x} {y}", Map.of("x", "a", "y", "b")));
		assertThrows(IllegalArgumentException.class, () -> PromptBuilder.render("{missing}", Map.of()));
	}
}
