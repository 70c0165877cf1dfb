package edu.harvard.hms.dbmi.avillach.pgx.processing;

import edu.harvard.hms.dbmi.avillach.pgx.data.genotype.AlleleCatalog;
import edu.harvard.hms.dbmi.avillach.pgx.data.rule.RuleTable;
import edu.harvard.hms.dbmi.avillach.pgx.exception.CatalogConfigurationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;

@Configuration
public class CatalogConfig {

    @Value("${PGX_ALLELE_CATALOG:classpath:catalog/alleles.json}")
    private String alleleCatalogLocation;

    @Value("${PGX_DRUG_RULES:classpath:catalog/drug-rules.json}")
    private String drugRulesLocation;

    @Bean
    public AlleleCatalog alleleCatalog(ResourceLoader resourceLoader) {
        Resource resource = resourceLoader.getResource(alleleCatalogLocation);
        try (InputStream in = resource.getInputStream()) {
            return AlleleCatalog.load(in);
        } catch (IOException e) {
            throw new CatalogConfigurationException("Unable to read allele catalog " + alleleCatalogLocation, e);
        }
    }

    @Bean
    public RuleTable ruleTable(ResourceLoader resourceLoader) {
        Resource resource = resourceLoader.getResource(drugRulesLocation);
        try (InputStream in = resource.getInputStream()) {
            return RuleTable.load(in);
        } catch (IOException e) {
            throw new CatalogConfigurationException("Unable to read drug rules " + drugRulesLocation, e);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
