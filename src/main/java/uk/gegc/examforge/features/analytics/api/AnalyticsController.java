package uk.gegc.examforge.features.analytics.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.examforge.features.analytics.api.dto.PaperSummary;
import uk.gegc.examforge.features.analytics.application.AggregationEngine;
import uk.gegc.examforge.shared.api.OwnerHeader;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/papers/approved/summary")
@RequiredArgsConstructor
@Validated
@Tag(name = "Analytics", description = "Statistics over approved papers")
public class AnalyticsController {

    private final AggregationEngine aggregationEngine;

    @Operation(
            summary = "Summarize approved papers",
            description = "Distributions, trends and heuristic suggestions over the caller's approved papers. "
                    + "A custom prompt adds a model-written analysis without changing any numbers."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Summary returned"),
            @ApiResponse(responseCode = "502", description = "Custom analysis failed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping
    public ResponseEntity<PaperSummary> summarize(
            @RequestHeader(OwnerHeader.NAME) String ownerId,
            @RequestParam(required = false) String subject,
            @RequestParam(required = false) String department,
            @RequestParam(required = false) UUID paperId,
            @RequestParam(required = false) @Size(max = 2000) String customPrompt
    ) {
        return ResponseEntity.ok(aggregationEngine.summarizeApproved(ownerId, subject, department, paperId, customPrompt));
    }
}
