package edu.harvard.hms.dbmi.avillach.pgx.data.result;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PharmacogenomicProfile(
    @Schema(description = "Gene governing the drug", example = "CYP2D6") String primaryGene,
    @Schema(description = "Canonical diplotype", example = "*1/*4") String diplotype,
    @Schema(description = "Resolved phenotype", example = "Intermediate Metabolizer") String phenotype,
    @Schema(description = "Summed allele activity, absent for indeterminate calls", example = "1.0") Double activityScore
) {
}
