package uk.gegc.examforge.features.history.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

public record ClearHistoryResponse(
        @Schema(description = "Number of history entries removed", example = "12")
        int deleted
) {
}
