package uk.gegc.examforge.features.paper.application;

import uk.gegc.examforge.features.paper.domain.model.RenderVariant;

/**
 * A rendered document that has not been stored yet.
 */
public record RenderedDocument(RenderVariant variant, String filename, String contentType, byte[] content) {
}
