package uk.gegc.examforge.features.paper.application;

import uk.gegc.examforge.features.paper.domain.model.GenerationRequest;
import uk.gegc.examforge.features.paper.domain.model.Paper;
import uk.gegc.examforge.features.paper.domain.model.PaperMetadataUpdate;
import uk.gegc.examforge.features.paper.domain.model.PaperStatus;
import uk.gegc.examforge.features.paper.domain.model.Question;

import java.util.List;
import java.util.UUID;

/**
 * Owns every mutation of a paper. All methods are scoped to the calling owner: a paper of another
 * owner is reported as not found.
 */
public interface PaperLifecycleService {

    Paper create(String ownerId, GenerationRequest request, List<Question> questions, String prompt);

    Paper get(String ownerId, UUID paperId);

    /**
     * @param status optional filter; {@code null} lists papers in every status
     */
    List<Paper> list(String ownerId, PaperStatus status);

    Paper updateMetadata(String ownerId, UUID paperId, PaperMetadataUpdate update);

    /**
     * Replaces the draft's questions with a fresh set. On failure the paper is left exactly as it
     * was and the failure is recorded in the history ledger before being rethrown.
     */
    Paper regenerate(String ownerId, UUID paperId, String feedbackPrompt);

    /**
     * Renders both documents and marks the paper approved. Either both artifacts exist and the
     * paper is approved, or nothing changed.
     */
    Paper approve(String ownerId, UUID paperId);

    Paper createEditCopy(String ownerId, UUID approvedPaperId);

    void delete(String ownerId, UUID paperId);

    List<Paper> search(String ownerId, String subject, String department);

    List<String> listApprovedSubjects(String ownerId);
}
