package edu.harvard.hms.dbmi.avillach.pgx.data.result;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RiskSummary(
    @Schema(description = "Risk label", example = "High") String riskLabel,
    @Schema(description = "Confidence in the verdict, from the guideline recommendation strength", example = "0.95") double confidenceScore,
    @Schema(description = "Severity tier", example = "critical") String severity,
    @Schema(description = "Clinical risk category", example = "Toxic") String category,
    @Schema(description = "Resolved phenotype", example = "Ultra-Rapid Metabolizer") String phenotype
) {
}
