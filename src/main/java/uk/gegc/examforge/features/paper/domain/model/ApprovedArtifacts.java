package uk.gegc.examforge.features.paper.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Embeddable
@Getter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class ApprovedArtifacts {

    @Column(name = "question_paper_artifact_id")
    private UUID questionPaperArtifactId;

    @Column(name = "answer_key_artifact_id")
    private UUID answerKeyArtifactId;
}
