package uk.gegc.examforge.features.paper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(description = "Share of questions by source, in percent. Must add up to 100.")
public record ProvenanceRequest(
        @Schema(example = "30") @NotNull Integer previousPercent,
        @Schema(example = "40") @NotNull Integer creativePercent,
        @Schema(example = "30") @NotNull Integer newPercent
) {
}
