package uk.gegc.examforge.features.paper.application;

import uk.gegc.examforge.features.paper.domain.model.GenerationRequest;
import uk.gegc.examforge.features.paper.domain.model.Paper;

/**
 * Entry point for producing a brand new draft paper from a request.
 */
public interface PaperGenerationFacade {

    /**
     * Validates the request, records a GENERATION history entry, calls the generation service and
     * persists the result as a draft. The history entry ends SUCCESS or FAILED in every case.
     */
    Paper generate(String ownerId, GenerationRequest request);
}
