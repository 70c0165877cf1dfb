package edu.harvard.hms.dbmi.avillach.pgx.data.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import edu.harvard.hms.dbmi.avillach.pgx.data.result.ResultRecord;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DrugStatus(
    @Schema(description = "Requested drug name") String drug,
    @Schema(description = "Current sub-state of this drug") DrugState state,
    @Schema(description = "What the drug produced; present once the job is finished") DrugOutcome outcome,
    @Schema(description = "Where processing stopped for a failed drug") FailureStage failureStage,
    @Schema(description = "Reason string for a failed drug") String failureReason,
    @Schema(description = "Risk result record; present when a verdict exists and the job is finished") ResultRecord result
) {

    public static DrugStatus inProgress(String drug, DrugState state) {
        return new DrugStatus(drug, state, null, null, null, null);
    }
}
