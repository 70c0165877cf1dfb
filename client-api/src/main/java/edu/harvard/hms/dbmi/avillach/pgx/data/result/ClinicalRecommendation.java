package edu.harvard.hms.dbmi.avillach.pgx.data.result;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ClinicalRecommendation(String summary, String dosing, String monitoring) {
}
