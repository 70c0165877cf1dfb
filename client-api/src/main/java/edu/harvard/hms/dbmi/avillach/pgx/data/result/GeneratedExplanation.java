package edu.harvard.hms.dbmi.avillach.pgx.data.result;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GeneratedExplanation(
    String variantInterpretation,
    String riskRationale,
    String dosingRationale,
    String monitoringRationale,
    @Schema(description = "Generator that wrote the text, empty when no explanation is available") String source
) {

    public static GeneratedExplanation empty() {
        return new GeneratedExplanation("", "", "", "", "");
    }
}
