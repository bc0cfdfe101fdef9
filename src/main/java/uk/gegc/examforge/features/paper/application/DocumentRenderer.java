package uk.gegc.examforge.features.paper.application;

import uk.gegc.examforge.features.paper.domain.model.Paper;
import uk.gegc.examforge.features.paper.domain.model.RenderVariant;

/**
 * Turns a paper into a downloadable document. Rendering has no side effects; storing the result
 * is left to the caller.
 */
public interface DocumentRenderer {

    /**
     * @throws uk.gegc.examforge.shared.exception.RenderException if the document could not be produced
     */
    RenderedDocument render(Paper paper, RenderVariant variant);
}
