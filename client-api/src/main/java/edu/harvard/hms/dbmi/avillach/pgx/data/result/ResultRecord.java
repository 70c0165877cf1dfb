package edu.harvard.hms.dbmi.avillach.pgx.data.result;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Exported shape of one (patient, drug) risk result.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResultRecord(
    @Schema(description = "Patient profile identifier") String patientId,
    @Schema(description = "Drug name as requested") String drug,
    @Schema(description = "ISO-8601 instant the risk verdict was produced") String timestamp,
    RiskSummary riskAssessment,
    GuidelineReference guidelineReference,
    PharmacogenomicProfile pharmacogenomicProfile,
    ClinicalRecommendation clinicalRecommendation,
    GeneratedExplanation generatedExplanation,
    QualityMetadata qualityMetadata
) {
}
