package edu.harvard.hms.dbmi.avillach.pgx.processing.generator;

import edu.harvard.hms.dbmi.avillach.pgx.processing.explanation.ExplanationPrompt;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Offline generator that writes each section from the prompt variables alone. The same
 * prompt always produces the same text.
 */
public class TemplateExplanationGenerator implements ExplanationGenerator {

    static final String PROVIDER = "template";
    static final String MODEL = "pgx-template-v1";

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public String model() {
        return MODEL;
    }

    @Override
    public Mono<String> generate(ExplanationPrompt prompt) {
        return Mono.fromCallable(() -> write(prompt));
    }

    private String write(ExplanationPrompt prompt) {
        Map<String, String> v = prompt.getVariables();
        switch (prompt.getTemplate()) {
            case VARIANT_EXPLANATION:
                String score = v.get("activity_score");
                return "The " + v.get("gene") + " diplotype " + v.get("diplotype") + " is classified as "
                        + v.get("phenotype")
                        + (score.equals("not determinable")
                            ? ". At least one allele has uncertain function, so no activity score can be assigned."
                            : " with an activity score of " + score + ".")
                        + " This describes how quickly drugs that depend on " + v.get("gene") + " are processed.";
            case RISK_EXPLANATION:
                return v.get("drug") + " carries a " + v.get("risk_level") + " risk (" + v.get("severity")
                        + " severity) for a " + v.get("gene") + " " + v.get("phenotype") + ". "
                        + v.get("clinical_guidance");
            case DOSING_ADJUSTMENT:
                return "Dosing guidance for " + v.get("drug") + " with a " + v.get("gene") + " "
                        + v.get("phenotype") + " phenotype: " + v.get("dosing");
            case MONITORING_GUIDANCE:
                return "Monitoring for " + v.get("drug") + ": " + v.get("monitoring");
            default:
                throw new IllegalArgumentException("Unsupported prompt template " + prompt.getTemplate());
        }
    }
}
