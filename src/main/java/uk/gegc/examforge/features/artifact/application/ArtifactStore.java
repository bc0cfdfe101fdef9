package uk.gegc.examforge.features.artifact.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.examforge.features.artifact.domain.model.PaperArtifact;
import uk.gegc.examforge.features.artifact.domain.repository.PaperArtifactRepository;
import uk.gegc.examforge.features.paper.domain.model.RenderVariant;
import uk.gegc.examforge.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Keeps rendered PDFs of approved papers. Artifacts are owned by their paper and go away with it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class ArtifactStore {

    private final PaperArtifactRepository artifactRepository;
    private final Clock clock;

    public PaperArtifact store(UUID paperId, String ownerId, RenderVariant variant, String filename,
                               String contentType, byte[] content) {
        PaperArtifact artifact = new PaperArtifact();
        artifact.setPaperId(paperId);
        artifact.setOwnerId(ownerId);
        artifact.setVariant(variant);
        artifact.setFilename(filename);
        artifact.setContentType(contentType);
        artifact.setContent(content);
        artifact.setSizeBytes(content.length);
        artifact.setCreatedAt(Instant.now(clock));
        PaperArtifact saved = artifactRepository.save(artifact);
        log.info("Stored {} artifact {} for paper {} ({} bytes)", variant, saved.getId(), paperId, content.length);
        return saved;
    }

    @Transactional(readOnly = true)
    public PaperArtifact get(String ownerId, UUID artifactId) {
        return artifactRepository.findByIdAndOwnerId(artifactId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Artifact " + artifactId + " not found"));
    }

    public int deleteForPaper(UUID paperId) {
        int deleted = artifactRepository.deleteAllByPaperId(paperId);
        if (deleted > 0) {
            log.info("Deleted {} artifacts of paper {}", deleted, paperId);
        }
        return deleted;
    }
}
