package uk.gegc.examforge.features.paper.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import uk.gegc.examforge.features.distribution.domain.model.DistributionSummary;
import uk.gegc.examforge.shared.exception.InvalidStateException;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * The canonical exam paper. One row per lineage; regeneration rewrites the row in place while an
 * edit copy of an approved paper starts a new lineage pointing back at its source.
 */
@Entity
@Table(name = "papers", indexes = {
        @Index(name = "idx_papers_owner_status", columnList = "owner_id, status"),
        @Index(name = "idx_papers_owner_created", columnList = "owner_id, created_at")
})
@Getter
@Setter
@NoArgsConstructor
public class Paper {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    @Column(name = "subject", nullable = false, length = 200)
    private String subject;

    @Column(name = "department", nullable = false, length = 200)
    private String department;

    @Column(name = "section", length = 100)
    private String section;

    @Column(name = "exam_year")
    private Integer year;

    @Column(name = "exam_date")
    private LocalDate examDate;

    @Column(name = "total_marks", nullable = false)
    private int totalMarks;

    @Enumerated(EnumType.STRING)
    @Column(name = "exam_type", nullable = false, length = 20)
    private ExamType examType = ExamType.FINAL;

    @Convert(converter = GenerationRequestConverter.class)
    @Column(name = "request_data", nullable = false, columnDefinition = "TEXT")
    private GenerationRequest request;

    @Column(name = "generation_prompt", columnDefinition = "MEDIUMTEXT")
    private String generationPrompt;

    @Convert(converter = QuestionListConverter.class)
    @Column(name = "questions", nullable = false, columnDefinition = "MEDIUMTEXT")
    private List<Question> questions = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PaperStatus status = PaperStatus.DRAFT;

    @Column(name = "regeneration_count", nullable = false)
    private int regenerationCount;

    @Column(name = "edit_copy", nullable = false)
    private boolean editCopy;

    @Column(name = "source_paper_id", updatable = false)
    private UUID sourcePaperId;

    @Embedded
    private ApprovedArtifacts approvedArtifacts;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Convert(converter = DistributionSummaryConverter.class)
    @Column(name = "distribution_summary", nullable = false, columnDefinition = "TEXT")
    private DistributionSummary distributionSummary = DistributionSummary.EMPTY;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public boolean isDraft() {
        return status == PaperStatus.DRAFT;
    }

    public boolean isApproved() {
        return status == PaperStatus.APPROVED;
    }

    /**
     * @throws InvalidStateException unless the paper is still a draft
     */
    public void requireDraft(String action) {
        if (!isDraft()) {
            throw new InvalidStateException("Cannot " + action + " paper " + id + " in status " + status);
        }
    }

    /**
     * Swaps in a freshly generated question list. The summary must have been computed from the same
     * list so both fields always change together.
     */
    public void replaceContent(List<Question> newQuestions, DistributionSummary summary, String prompt) {
        this.questions = List.copyOf(newQuestions);
        this.distributionSummary = summary;
        this.generationPrompt = prompt;
    }

    public void recordSuccessfulRegeneration(List<Question> newQuestions, DistributionSummary summary, String prompt) {
        requireDraft("regenerate");
        replaceContent(newQuestions, summary, prompt);
        this.regenerationCount++;
    }

    public void approve(ApprovedArtifacts artifacts, Instant at) {
        if (!PaperStateMachine.isValidTransition(status, PaperStatus.APPROVED)) {
            throw new InvalidStateException("Cannot approve paper " + id + " in status " + status);
        }
        this.status = PaperStatus.APPROVED;
        this.approvedArtifacts = artifacts;
        this.approvedAt = at;
    }

    /**
     * Builds a new draft lineage from this approved paper. The copy shares no identity with the
     * source and starts with no artifacts and no regenerations.
     */
    public Paper forkEditCopy() {
        if (!isApproved()) {
            throw new InvalidStateException("Only approved papers can be copied for editing; paper "
                    + id + " is " + status);
        }
        Paper copy = new Paper();
        copy.ownerId = ownerId;
        copy.subject = subject;
        copy.department = department;
        copy.section = section;
        copy.year = year;
        copy.examDate = examDate;
        copy.totalMarks = totalMarks;
        copy.examType = examType;
        copy.request = request;
        copy.generationPrompt = generationPrompt;
        copy.questions = List.copyOf(questions);
        copy.distributionSummary = distributionSummary;
        copy.status = PaperStatus.DRAFT;
        copy.regenerationCount = 0;
        copy.editCopy = true;
        copy.sourcePaperId = id;
        return copy;
    }
}
