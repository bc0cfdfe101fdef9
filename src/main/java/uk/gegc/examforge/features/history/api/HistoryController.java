package uk.gegc.examforge.features.history.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.examforge.features.history.api.dto.ClearHistoryResponse;
import uk.gegc.examforge.features.history.api.dto.HistoryEntryDto;
import uk.gegc.examforge.features.history.application.HistoryLedger;
import uk.gegc.examforge.features.history.infra.mapping.HistoryMapper;
import uk.gegc.examforge.shared.api.OwnerHeader;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/history")
@RequiredArgsConstructor
@Tag(name = "Generation History", description = "Ledger of paper generation and regeneration attempts")
public class HistoryController {

    private final HistoryLedger historyLedger;
    private final HistoryMapper historyMapper;

    @Operation(summary = "List history", description = "Returns the caller's history entries, newest first.")
    @GetMapping
    public ResponseEntity<List<HistoryEntryDto>> listHistory(
            @Parameter(description = "Caller id forwarded by the gateway")
            @RequestHeader(OwnerHeader.NAME) String ownerId
    ) {
        List<HistoryEntryDto> entries = historyLedger.list(ownerId).stream()
                .map(historyMapper::toDto)
                .toList();
        return ResponseEntity.ok(entries);
    }

    @Operation(summary = "Get a history entry")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Entry returned"),
            @ApiResponse(responseCode = "404", description = "Entry not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{entryId}")
    public ResponseEntity<HistoryEntryDto> getHistoryEntry(
            @RequestHeader(OwnerHeader.NAME) String ownerId,
            @PathVariable UUID entryId
    ) {
        return ResponseEntity.ok(historyMapper.toDto(historyLedger.get(ownerId, entryId)));
    }

    @Operation(summary = "Delete a history entry", description = "Papers produced by the attempt are not affected.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Entry deleted"),
            @ApiResponse(responseCode = "404", description = "Entry not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @DeleteMapping("/{entryId}")
    public ResponseEntity<Void> deleteHistoryEntry(
            @RequestHeader(OwnerHeader.NAME) String ownerId,
            @PathVariable UUID entryId
    ) {
        historyLedger.delete(ownerId, entryId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Clear history", description = "Deletes every history entry of the caller. Papers are kept.")
    @DeleteMapping
    public ResponseEntity<ClearHistoryResponse> clearHistory(
            @RequestHeader(OwnerHeader.NAME) String ownerId
    ) {
        return ResponseEntity.ok(new ClearHistoryResponse(historyLedger.clearAll(ownerId)));
    }
}
