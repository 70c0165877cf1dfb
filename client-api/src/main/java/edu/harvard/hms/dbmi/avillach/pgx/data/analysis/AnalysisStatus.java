package edu.harvard.hms.dbmi.avillach.pgx.data.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisStatus(
    @Schema(description = "Job identifier returned on submission") String jobId,
    @Schema(description = "Patient profile the job analyses") String patientId,
    @Schema(description = "Overall job state") JobState state,
    @Schema(description = "True when the job was cancelled by a caller") boolean cancelled,
    @Schema(description = "Epoch millis at submission") long queuedTime,
    @Schema(description = "Epoch millis when the job reached a terminal state") Long completedTime,
    @Schema(description = "Number of jobs waiting for a worker") int queueDepth,
    @Schema(description = "Position of this job among waiting jobs, -1 once it has left the queue") int positionInQueue,
    @Schema(description = "Per-drug state in request order") List<DrugStatus> drugs
) {
}
