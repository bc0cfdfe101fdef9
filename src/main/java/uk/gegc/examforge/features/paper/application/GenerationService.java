package uk.gegc.examforge.features.paper.application;

import uk.gegc.examforge.features.paper.domain.model.GenerationRequest;
import uk.gegc.examforge.features.paper.domain.model.Question;

import java.util.List;

/**
 * Produces the questions of a paper. Implementations talk to a model provider and may be slow or
 * fail; callers bound them with a timeout.
 */
public interface GenerationService {

    /**
     * @param prompt         full instruction text for this attempt
     * @param feedbackPrompt optional reviewer feedback for a regeneration, may be {@code null}
     * @throws uk.gegc.examforge.shared.exception.GenerationException when no usable question list
     *                                                                could be produced
     */
    List<Question> generate(GenerationRequest request, String prompt, String feedbackPrompt);
}
