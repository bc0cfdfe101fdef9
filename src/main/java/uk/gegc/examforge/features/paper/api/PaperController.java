package uk.gegc.examforge.features.paper.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.examforge.features.paper.api.dto.GeneratePaperRequest;
import uk.gegc.examforge.features.paper.api.dto.PaperDto;
import uk.gegc.examforge.features.paper.api.dto.PaperSummaryDto;
import uk.gegc.examforge.features.paper.api.dto.RegeneratePaperRequest;
import uk.gegc.examforge.features.paper.api.dto.UpdatePaperMetadataRequest;
import uk.gegc.examforge.features.paper.application.PaperGenerationFacade;
import uk.gegc.examforge.features.paper.application.PaperLifecycleService;
import uk.gegc.examforge.features.paper.domain.model.Paper;
import uk.gegc.examforge.features.paper.domain.model.PaperStatus;
import uk.gegc.examforge.features.paper.infra.mapping.PaperMapper;
import uk.gegc.examforge.shared.api.OwnerHeader;

import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/papers")
@RequiredArgsConstructor
@Tag(name = "Papers", description = "Generate, review, approve and search exam papers")
public class PaperController {

    private final PaperGenerationFacade paperGenerationFacade;
    private final PaperLifecycleService paperLifecycleService;
    private final PaperMapper paperMapper;

    @Operation(
            summary = "Generate a draft paper",
            description = "Calls the generation model synchronously and stores the result as a DRAFT. "
                    + "The attempt is recorded in the generation history whether it succeeds or not."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Draft created"),
            @ApiResponse(responseCode = "400", description = "Invalid request",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Generation failed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/generate")
    public ResponseEntity<PaperDto> generatePaper(
            @Parameter(description = "Caller id forwarded by the gateway")
            @RequestHeader(OwnerHeader.NAME) String ownerId,
            @RequestBody @Valid GeneratePaperRequest request
    ) {
        log.info("Generating paper for owner {} subject {}", ownerId, request.subject());
        Paper paper = paperGenerationFacade.generate(ownerId, paperMapper.toGenerationRequest(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(paperMapper.toDto(paper));
    }

    @Operation(summary = "Get a paper")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Paper returned"),
            @ApiResponse(responseCode = "404", description = "Paper not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{paperId}")
    public ResponseEntity<PaperDto> getPaper(
            @RequestHeader(OwnerHeader.NAME) String ownerId,
            @PathVariable UUID paperId
    ) {
        return ResponseEntity.ok(paperMapper.toDto(paperLifecycleService.get(ownerId, paperId)));
    }

    @Operation(summary = "List papers", description = "Newest first, optionally filtered by status.")
    @GetMapping
    public ResponseEntity<List<PaperSummaryDto>> listPapers(
            @RequestHeader(OwnerHeader.NAME) String ownerId,
            @RequestParam(required = false) PaperStatus status
    ) {
        return ResponseEntity.ok(toSummaries(paperLifecycleService.list(ownerId, status)));
    }

    @Operation(summary = "Edit draft metadata", description = "Only DRAFT papers can be edited. Questions are not touched.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Metadata updated"),
            @ApiResponse(responseCode = "400", description = "Empty or invalid update",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Paper is not a draft or is being modified",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PatchMapping("/{paperId}/metadata")
    public ResponseEntity<PaperDto> updateMetadata(
            @RequestHeader(OwnerHeader.NAME) String ownerId,
            @PathVariable UUID paperId,
            @RequestBody @Valid UpdatePaperMetadataRequest request
    ) {
        Paper paper = paperLifecycleService.updateMetadata(ownerId, paperId, paperMapper.toMetadataUpdate(request));
        return ResponseEntity.ok(paperMapper.toDto(paper));
    }

    @Operation(summary = "Regenerate a draft", description = "Replaces all questions. On failure the draft is unchanged.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Questions replaced"),
            @ApiResponse(responseCode = "409", description = "Paper is not a draft or is being modified",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Generation failed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{paperId}/regenerate")
    public ResponseEntity<PaperDto> regeneratePaper(
            @RequestHeader(OwnerHeader.NAME) String ownerId,
            @PathVariable UUID paperId,
            @RequestBody(required = false) @Valid RegeneratePaperRequest request
    ) {
        String feedback = request == null ? null : request.feedbackPrompt();
        return ResponseEntity.ok(paperMapper.toDto(paperLifecycleService.regenerate(ownerId, paperId, feedback)));
    }

    @Operation(summary = "Approve a draft", description = "Renders the question paper and the answer key, then freezes the paper.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Paper approved"),
            @ApiResponse(responseCode = "409", description = "Paper is not a draft or is being modified",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Rendering failed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{paperId}/approve")
    public ResponseEntity<PaperDto> approvePaper(
            @RequestHeader(OwnerHeader.NAME) String ownerId,
            @PathVariable UUID paperId
    ) {
        return ResponseEntity.ok(paperMapper.toDto(paperLifecycleService.approve(ownerId, paperId)));
    }

    @Operation(summary = "Create an edit copy", description = "Copies an approved paper into a new draft. The original is untouched.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Draft copy created"),
            @ApiResponse(responseCode = "409", description = "Source paper is not approved",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{paperId}/edit-copy")
    public ResponseEntity<PaperDto> createEditCopy(
            @RequestHeader(OwnerHeader.NAME) String ownerId,
            @PathVariable UUID paperId
    ) {
        Paper copy = paperLifecycleService.createEditCopy(ownerId, paperId);
        return ResponseEntity.status(HttpStatus.CREATED).body(paperMapper.toDto(copy));
    }

    @Operation(summary = "Delete a paper", description = "Also deletes its rendered documents.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Paper deleted"),
            @ApiResponse(responseCode = "404", description = "Paper not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @DeleteMapping("/{paperId}")
    public ResponseEntity<Void> deletePaper(
            @RequestHeader(OwnerHeader.NAME) String ownerId,
            @PathVariable UUID paperId
    ) {
        paperLifecycleService.delete(ownerId, paperId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Search approved papers", description = "Case-insensitive substring match on subject and department.")
    @GetMapping("/approved")
    public ResponseEntity<List<PaperSummaryDto>> searchApproved(
            @RequestHeader(OwnerHeader.NAME) String ownerId,
            @RequestParam(required = false) String subject,
            @RequestParam(required = false) String department
    ) {
        return ResponseEntity.ok(toSummaries(paperLifecycleService.search(ownerId, subject, department)));
    }

    @Operation(summary = "List subjects of approved papers")
    @GetMapping("/approved/subjects")
    public ResponseEntity<List<String>> listApprovedSubjects(
            @RequestHeader(OwnerHeader.NAME) String ownerId
    ) {
        return ResponseEntity.ok(paperLifecycleService.listApprovedSubjects(ownerId));
    }

    private List<PaperSummaryDto> toSummaries(List<Paper> papers) {
        return papers.stream().map(paperMapper::toSummaryDto).toList();
    }
}
