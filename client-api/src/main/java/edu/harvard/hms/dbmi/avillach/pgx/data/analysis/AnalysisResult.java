package edu.harvard.hms.dbmi.avillach.pgx.data.analysis;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Aggregated outcome of a finished job. Only built once every drug has reached a terminal
 * state, so it never reflects a half finished analysis.
 */
public record AnalysisResult(
    @Schema(description = "Job identifier") String jobId,
    @Schema(description = "Patient profile identifier") String patientId,
    @Schema(description = "Terminal job state") JobState state,
    @Schema(description = "True when the job was cancelled by a caller") boolean cancelled,
    @Schema(description = "Epoch millis at submission") long queuedTime,
    @Schema(description = "Epoch millis at completion") long completedTime,
    @Schema(description = "Per-drug outcome in request order") List<DrugStatus> drugs
) {
}
