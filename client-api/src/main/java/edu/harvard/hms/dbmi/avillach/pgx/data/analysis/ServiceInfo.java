package edu.harvard.hms.dbmi.avillach.pgx.data.analysis;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Map;

public record ServiceInfo(
    @Schema(description = "Service name") String name,
    @Schema(description = "Generator writing explanations", example = "template") String generatorProvider,
    @Schema(description = "Model used by the generator", example = "gpt-3.5-turbo") String generatorModel,
    @Schema(description = "Genes with phenotype tables") List<String> genes,
    @Schema(description = "Drugs with dosing rules") List<String> drugs,
    @Schema(description = "Explanation cache counters: entries, hits, misses, writes, conflicts") Map<String, Long> cacheStatistics
) {
}
