package uk.gegc.examforge.features.artifact.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.examforge.features.artifact.application.ArtifactStore;
import uk.gegc.examforge.features.artifact.domain.model.PaperArtifact;
import uk.gegc.examforge.shared.api.OwnerHeader;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/artifacts")
@RequiredArgsConstructor
@Tag(name = "Artifacts", description = "Download rendered documents of approved papers")
public class ArtifactController {

    private final ArtifactStore artifactStore;

    @Operation(summary = "Download an artifact")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Document returned",
                    content = @Content(mediaType = MediaType.APPLICATION_PDF_VALUE)),
            @ApiResponse(responseCode = "404", description = "Artifact not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{artifactId}")
    public ResponseEntity<byte[]> downloadArtifact(
            @RequestHeader(OwnerHeader.NAME) String ownerId,
            @PathVariable UUID artifactId
    ) {
        PaperArtifact artifact = artifactStore.get(ownerId, artifactId);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(artifact.getContentType()))
                .contentLength(artifact.getSizeBytes())
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(artifact.getFilename())
                        .build()
                        .toString())
                .body(artifact.getContent());
    }
}
