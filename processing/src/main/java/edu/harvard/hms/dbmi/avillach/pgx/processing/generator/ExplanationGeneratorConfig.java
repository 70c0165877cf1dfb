package edu.harvard.hms.dbmi.avillach.pgx.processing.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExplanationGeneratorConfig {

    private static Logger log = LoggerFactory.getLogger(ExplanationGeneratorConfig.class);

    @Value("${pgx.generator.model:gpt-3.5-turbo}")
    private String model;

    @Bean(name = "remoteExplanationGenerator")
    @ConditionalOnProperty(prefix = "pgx.generator", name = "impl", havingValue = "remote")
    public ExplanationGenerator remoteExplanationGenerator(
        @Value("${pgx.generator.remote.url}") String url,
        @Value("${pgx.generator.remote.api-key:}") String apiKey
    ) {
        log.info("Explanations will be generated by " + model + " at " + url);
        return new ExplanationGeneratorRestClient(url, apiKey, model);
    }

    @Bean(name = "templateExplanationGenerator")
    @ConditionalOnProperty(prefix = "pgx.generator", name = "impl", havingValue = "template")
    public ExplanationGenerator templateExplanationGenerator() {
        log.info("Explanations will be written from offline templates");
        return new TemplateExplanationGenerator();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExplanationGenerator disabledExplanationGenerator() {
        log.warn("No explanation generator configured, drug results will carry verdicts only");
        return new DisabledExplanationGenerator();
    }
}
