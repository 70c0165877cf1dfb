package edu.harvard.hms.dbmi.avillach.pgx.processing.generator;

import edu.harvard.hms.dbmi.avillach.pgx.processing.explanation.ExplanationPrompt;
import reactor.core.publisher.Mono;

/**
 * Writes the text of one explanation section. Failures are signalled as
 * {@link edu.harvard.hms.dbmi.avillach.pgx.exception.GeneratorUnavailableException}, flagged
 * retryable when a later attempt could succeed.
 */
public interface ExplanationGenerator {

    String provider();

    String model();

    /**
     * Identifies the generator in cache keys, so text from one generator is never served as another's.
     */
    default String versionTag() {
        return provider() + "/" + model();
    }

    Mono<String> generate(ExplanationPrompt prompt);
}
