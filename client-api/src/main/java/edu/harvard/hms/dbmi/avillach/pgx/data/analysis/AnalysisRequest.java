package edu.harvard.hms.dbmi.avillach.pgx.data.analysis;

import io.swagger.v3.oas.annotations.media.Schema;
import org.springframework.lang.NonNull;

import java.util.List;
import java.util.Map;

public record AnalysisRequest(
    @Schema(description = "Identifier of the patient profile the genotype calls belong to", example = "PATIENT_001") String patientId,
    @Schema(
        description = "Diplotype per gene symbol, each as a pair of allele labels",
        example = "{\"CYP2D6\": {\"allele1\": \"*1\", \"allele2\": \"*4\"}}"
    ) Map<String, DiplotypeCall> genotypes,
    @Schema(description = "Drugs to assess, in the order results should be reported", example = "[\"Codeine\", \"Warfarin\"]") List<String> drugs
) {

    @Override
    @NonNull
    public Map<String, DiplotypeCall> genotypes() {
        return genotypes == null ? Map.of() : genotypes;
    }

    @Override
    @NonNull
    public List<String> drugs() {
        return drugs == null ? List.of() : drugs;
    }
}
