package edu.harvard.hms.dbmi.avillach.pgx.data.result;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QualityMetadata(
    String generatorProvider,
    String generatorModel,
    boolean cacheHit,
    int genesAnalyzed,
    String algorithmVersion
) {
}
