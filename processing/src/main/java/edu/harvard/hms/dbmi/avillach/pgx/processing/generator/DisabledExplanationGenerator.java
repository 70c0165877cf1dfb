package edu.harvard.hms.dbmi.avillach.pgx.processing.generator;

import edu.harvard.hms.dbmi.avillach.pgx.exception.GeneratorUnavailableException;
import edu.harvard.hms.dbmi.avillach.pgx.processing.explanation.ExplanationPrompt;
import reactor.core.publisher.Mono;

public class DisabledExplanationGenerator implements ExplanationGenerator {

    @Override
    public String provider() {
        return "none";
    }

    @Override
    public String model() {
        return "none";
    }

    @Override
    public Mono<String> generate(ExplanationPrompt prompt) {
        return Mono.error(new GeneratorUnavailableException("no explanation generator configured", false));
    }
}
