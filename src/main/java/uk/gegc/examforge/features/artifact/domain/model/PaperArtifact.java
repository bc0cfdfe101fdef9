package uk.gegc.examforge.features.artifact.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.examforge.features.paper.domain.model.RenderVariant;

import java.time.Instant;
import java.util.UUID;

/**
 * A rendered document of an approved paper.
 */
@Entity
@Table(name = "paper_artifacts", indexes = {
        @Index(name = "idx_artifacts_paper", columnList = "paper_id")
})
@Getter
@Setter
@NoArgsConstructor
public class PaperArtifact {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "paper_id", nullable = false)
    private UUID paperId;

    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "variant", nullable = false, length = 20)
    private RenderVariant variant;

    @Column(name = "filename", nullable = false)
    private String filename;

    @Column(name = "content_type", nullable = false, length = 100)
    private String contentType;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(name = "content", nullable = false, columnDefinition = "LONGBLOB")
    private byte[] content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
