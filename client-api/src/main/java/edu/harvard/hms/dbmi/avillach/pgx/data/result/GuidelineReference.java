package edu.harvard.hms.dbmi.avillach.pgx.data.result;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GuidelineReference(
    @Schema(description = "CPIC evidence level", example = "1A") String recommendationLevel,
    @Schema(description = "Recommendation strength", example = "Strong") String strength,
    @Schema(description = "Guideline citation") String citation
) {
}
