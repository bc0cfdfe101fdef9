package uk.gegc.examforge.features.paper.api.dto;

import java.util.UUID;

public record ArtifactLinksDto(
        UUID questionPaperArtifactId,
        String questionPaperUrl,
        UUID answerKeyArtifactId,
        String answerKeyUrl
) {
}
