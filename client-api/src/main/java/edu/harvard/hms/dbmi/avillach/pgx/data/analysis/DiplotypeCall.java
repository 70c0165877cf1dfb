package edu.harvard.hms.dbmi.avillach.pgx.data.analysis;

import io.swagger.v3.oas.annotations.media.Schema;

public record DiplotypeCall(
    @Schema(description = "First allele label as called for the gene", example = "*1", requiredMode = Schema.RequiredMode.REQUIRED) String allele1,
    @Schema(description = "Second allele label as called for the gene", example = "*2", requiredMode = Schema.RequiredMode.REQUIRED) String allele2
) {

    public String display() {
        return allele1 + "/" + allele2;
    }
}
