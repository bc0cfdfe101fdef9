package uk.gegc.examforge.features.history.domain.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import uk.gegc.examforge.shared.exception.InvalidStateException;

import java.time.Instant;
import java.util.UUID;

/**
 * One generation or regeneration attempt. Entries outlive the papers they produced.
 */
@Entity
@Table(name = "generation_history", indexes = {
        @Index(name = "idx_history_owner_created", columnList = "owner_id, created_at")
})
@Data
@NoArgsConstructor
public class HistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private HistoryKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private HistoryStatus status;

    @Column(name = "request_parameters", columnDefinition = "TEXT")
    private String requestParameters;

    @Column(name = "prompt", columnDefinition = "MEDIUMTEXT")
    private String prompt;

    @Column(name = "feedback_prompt", columnDefinition = "TEXT")
    private String feedbackPrompt;

    @Column(name = "source_paper_id")
    private UUID sourcePaperId;

    @Column(name = "paper_id")
    private UUID paperId;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public void markSucceeded(UUID producedPaperId, Instant at) {
        requireInProgress();
        this.status = HistoryStatus.SUCCESS;
        this.paperId = producedPaperId;
        this.completedAt = at;
    }

    public void markFailed(String message, Instant at) {
        requireInProgress();
        this.status = HistoryStatus.FAILED;
        this.errorMessage = message;
        this.completedAt = at;
    }

    private void requireInProgress() {
        if (status != HistoryStatus.IN_PROGRESS) {
            throw new InvalidStateException("History entry " + id + " is already " + status);
        }
    }
}
