package uk.gegc.examforge.features.paper.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;
import uk.gegc.examforge.features.artifact.application.ArtifactStore;
import uk.gegc.examforge.features.distribution.application.DistributionCalculator;
import uk.gegc.examforge.features.distribution.domain.model.DistributionSummary;
import uk.gegc.examforge.features.distribution.domain.model.DistributionTargets;
import uk.gegc.examforge.features.history.application.HistoryLedger;
import uk.gegc.examforge.features.history.domain.model.HistoryKind;
import uk.gegc.examforge.features.paper.application.DocumentRenderer;
import uk.gegc.examforge.features.paper.application.GenerationPromptBuilder;
import uk.gegc.examforge.features.paper.application.GenerationService;
import uk.gegc.examforge.features.paper.application.PaperLifecycleService;
import uk.gegc.examforge.features.paper.application.PaperMetrics;
import uk.gegc.examforge.features.paper.application.RenderedDocument;
import uk.gegc.examforge.features.paper.domain.model.ApprovedArtifacts;
import uk.gegc.examforge.features.paper.domain.model.GenerationRequest;
import uk.gegc.examforge.features.paper.domain.model.Paper;
import uk.gegc.examforge.features.paper.domain.model.PaperMetadataUpdate;
import uk.gegc.examforge.features.paper.domain.model.PaperStatus;
import uk.gegc.examforge.features.paper.domain.model.Question;
import uk.gegc.examforge.features.paper.domain.model.RenderVariant;
import uk.gegc.examforge.features.paper.domain.repository.PaperRepository;
import uk.gegc.examforge.shared.concurrency.ExternalCallRunner;
import uk.gegc.examforge.shared.concurrency.LineageLeaseRegistry;
import uk.gegc.examforge.shared.config.ExamProperties;
import uk.gegc.examforge.shared.exception.ConflictException;
import uk.gegc.examforge.shared.exception.GenerationException;
import uk.gegc.examforge.shared.exception.RenderException;
import uk.gegc.examforge.shared.exception.ResourceNotFoundException;
import uk.gegc.examforge.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * No database transaction is open while a collaborator is called. Lost updates between processes
 * are caught by the paper's version column.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaperLifecycleServiceImpl implements PaperLifecycleService {

    private final PaperRepository paperRepository;
    private final ArtifactStore artifactStore;
    private final DistributionCalculator distributionCalculator;
    private final HistoryLedger historyLedger;
    private final GenerationService generationService;
    private final DocumentRenderer documentRenderer;
    private final GenerationPromptBuilder promptBuilder;
    private final LineageLeaseRegistry leaseRegistry;
    private final ExternalCallRunner externalCallRunner;
    private final TransactionTemplate transactionTemplate;
    private final ExamProperties examProperties;
    private final PaperMetrics paperMetrics;
    private final Clock clock;

    @Override
    public Paper create(String ownerId, GenerationRequest request, List<Question> questions, String prompt) {
        requireOwner(ownerId);
        DistributionTargets targets = distributionCalculator.computeTargets(request);
        if (questions == null || questions.isEmpty()) {
            throw new ValidationException("A paper needs at least one question");
        }
        DistributionSummary summary = distributionCalculator.computeRealized(questions);
        warnOnDrift(null, targets, summary);

        Paper paper = new Paper();
        paper.setOwnerId(ownerId);
        paper.setSubject(request.subject());
        paper.setDepartment(request.department());
        paper.setSection(request.section());
        paper.setYear(request.year());
        paper.setExamDate(request.examDate());
        paper.setExamType(request.examType());
        paper.setTotalMarks(targets.totalMarks());
        paper.setRequest(request);
        paper.replaceContent(questions, summary, prompt);

        Paper saved = paperRepository.save(paper);
        log.info("Created draft paper {} for owner {} ({} questions, {} marks)",
                saved.getId(), ownerId, summary.totalQuestions(), targets.totalMarks());
        return saved;
    }

    @Override
    public Paper get(String ownerId, UUID paperId) {
        return paperRepository.findByIdAndOwnerId(paperId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Paper " + paperId + " not found"));
    }

    @Override
    public List<Paper> list(String ownerId, PaperStatus status) {
        if (status == null) {
            return paperRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
        }
        return paperRepository.findByOwnerIdAndStatusOrderByCreatedAtDesc(ownerId, status);
    }

    @Override
    public Paper updateMetadata(String ownerId, UUID paperId, PaperMetadataUpdate update) {
        if (update == null || update.isEmpty()) {
            throw new ValidationException("At least one metadata field must be provided");
        }
        validateMetadata(update);

        return leaseRegistry.runExclusive(paperId, () -> {
            Paper paper = get(ownerId, paperId);
            paper.requireDraft("edit metadata of");
            applyMetadata(paper, update);
            Paper saved = saveVersioned(paper);
            log.info("Updated metadata of paper {}", paperId);
            return saved;
        });
    }

    @Override
    public Paper regenerate(String ownerId, UUID paperId, String feedbackPrompt) {
        return leaseRegistry.runExclusive(paperId, () -> {
            Paper paper = get(ownerId, paperId);
            paper.requireDraft("regenerate");
            GenerationRequest request = paper.getRequest();
            String feedback = StringUtils.hasText(feedbackPrompt) ? feedbackPrompt.trim() : null;
            String prompt = promptBuilder.buildRegenerationPrompt(paper, feedback);

            UUID entryId = historyLedger.open(ownerId, HistoryKind.REGENERATION, request, prompt, feedback, paperId);
            log.info("Regenerating paper {} (attempt {})", paperId, paper.getRegenerationCount() + 1);

            List<Question> questions;
            DistributionSummary summary;
            try {
                questions = externalCallRunner.call("Regeneration of paper " + paperId,
                        Duration.ofSeconds(examProperties.getGeneration().getTimeoutSeconds()),
                        GenerationException.class, GenerationException::new,
                        () -> generationService.generate(request, prompt, feedback));
                if (questions == null || questions.isEmpty()) {
                    throw new GenerationException("Generation service returned no questions");
                }
                summary = distributionCalculator.computeRealized(questions);
            } catch (RuntimeException e) {
                recordFailure(entryId, e);
                paperMetrics.failure("regenerate");
                log.error("Regeneration of paper {} failed: {}", paperId, e.getMessage());
                throw e;
            }

            warnOnDrift(paperId, distributionCalculator.computeTargets(request), summary);
            paper.recordSuccessfulRegeneration(questions, summary, prompt);

            Paper saved;
            try {
                saved = saveVersioned(paper);
            } catch (ConflictException e) {
                recordFailure(entryId, e);
                paperMetrics.failure("regenerate");
                throw e;
            }
            recordSuccess(entryId, saved.getId());
            paperMetrics.success("regenerate");
            log.info("Paper {} regenerated, regeneration count is now {}", paperId, saved.getRegenerationCount());
            return saved;
        });
    }

    @Override
    public Paper approve(String ownerId, UUID paperId) {
        return leaseRegistry.runExclusive(paperId, () -> {
            Paper paper = get(ownerId, paperId);
            paper.requireDraft("approve");

            // nothing is stored until both documents exist
            RenderedDocument questionPaper;
            RenderedDocument answerKey;
            try {
                questionPaper = render(paper, RenderVariant.QUESTIONS_ONLY);
                answerKey = render(paper, RenderVariant.WITH_ANSWERS);
            } catch (RuntimeException e) {
                paperMetrics.failure("approve");
                log.error("Approval of paper {} aborted, rendering failed: {}", paperId, e.getMessage());
                throw e;
            }

            try {
                Paper saved = transactionTemplate.execute(status -> {
                    UUID questionPaperId = store(paper, questionPaper);
                    UUID answerKeyId = store(paper, answerKey);
                    paper.approve(new ApprovedArtifacts(questionPaperId, answerKeyId), Instant.now(clock));
                    return paperRepository.save(paper);
                });
                paperMetrics.success("approve");
                log.info("Paper {} approved with artifacts {}", paperId, saved.getApprovedArtifacts());
                return saved;
            } catch (OptimisticLockingFailureException e) {
                paperMetrics.failure("approve");
                throw concurrentModification(paper, e);
            } catch (RuntimeException e) {
                paperMetrics.failure("approve");
                throw e;
            }
        });
    }

    @Override
    public Paper createEditCopy(String ownerId, UUID approvedPaperId) {
        return leaseRegistry.runExclusive(approvedPaperId, () -> {
            Paper source = get(ownerId, approvedPaperId);
            Paper copy = paperRepository.save(source.forkEditCopy());
            log.info("Created edit copy {} of approved paper {}", copy.getId(), approvedPaperId);
            return copy;
        });
    }

    @Override
    public void delete(String ownerId, UUID paperId) {
        leaseRegistry.runExclusive(paperId, () -> {
            Paper paper = get(ownerId, paperId);
            transactionTemplate.executeWithoutResult(status -> {
                artifactStore.deleteForPaper(paper.getId());
                paperRepository.delete(paper);
            });
            log.info("Deleted paper {} of owner {}", paperId, ownerId);
        });
    }

    @Override
    public List<Paper> search(String ownerId, String subject, String department) {
        return paperRepository.search(ownerId, PaperStatus.APPROVED, normalizeFilter(subject), normalizeFilter(department));
    }

    @Override
    public List<String> listApprovedSubjects(String ownerId) {
        return paperRepository.findDistinctSubjects(ownerId, PaperStatus.APPROVED);
    }

    private RenderedDocument render(Paper paper, RenderVariant variant) {
        return externalCallRunner.call(variant + " rendering of paper " + paper.getId(),
                Duration.ofSeconds(examProperties.getRender().getTimeoutSeconds()),
                RenderException.class, RenderException::new,
                () -> documentRenderer.render(paper, variant));
    }

    private UUID store(Paper paper, RenderedDocument document) {
        return artifactStore.store(paper.getId(), paper.getOwnerId(), document.variant(), document.filename(),
                document.contentType(), document.content()).getId();
    }

    /**
     * The ledger entry may have been deleted while the attempt was running. The attempt's own
     * failure is what the caller sees either way.
     */
    private void recordFailure(UUID entryId, RuntimeException cause) {
        try {
            historyLedger.fail(entryId, cause.getMessage());
        } catch (RuntimeException ledgerFailure) {
            log.warn("Could not record failure on history entry {}: {}", entryId, ledgerFailure.getMessage());
            cause.addSuppressed(ledgerFailure);
        }
    }

    private void recordSuccess(UUID entryId, UUID paperId) {
        try {
            historyLedger.complete(entryId, paperId);
        } catch (ResourceNotFoundException e) {
            log.warn("History entry {} was removed before paper {} could be recorded on it", entryId, paperId);
        }
    }

    private Paper saveVersioned(Paper paper) {
        try {
            return paperRepository.save(paper);
        } catch (OptimisticLockingFailureException e) {
            throw concurrentModification(paper, e);
        }
    }

    private static ConflictException concurrentModification(Paper paper, OptimisticLockingFailureException e) {
        log.warn("Paper {} was modified concurrently", paper.getId());
        return new ConflictException("Paper " + paper.getId() + " was modified concurrently", e);
    }

    private void validateMetadata(PaperMetadataUpdate update) {
        if (update.subject() != null && update.subject().isBlank()) {
            throw new ValidationException("Subject must not be blank");
        }
        if (update.department() != null && update.department().isBlank()) {
            throw new ValidationException("Department must not be blank");
        }
        if (update.totalMarks() != null && update.totalMarks() <= 0) {
            throw new ValidationException("Total marks must be a positive integer");
        }
        if (update.year() != null && update.year() <= 0) {
            throw new ValidationException("Year must be a positive integer");
        }
    }

    private void applyMetadata(Paper paper, PaperMetadataUpdate update) {
        if (update.subject() != null) {
            paper.setSubject(update.subject().trim());
        }
        if (update.department() != null) {
            paper.setDepartment(update.department().trim());
        }
        if (update.section() != null) {
            paper.setSection(update.section().trim());
        }
        if (update.year() != null) {
            paper.setYear(update.year());
        }
        if (update.examDate() != null) {
            paper.setExamDate(update.examDate());
        }
        if (update.totalMarks() != null) {
            paper.setTotalMarks(update.totalMarks());
        }
        if (update.examType() != null) {
            paper.setExamType(update.examType());
        }
        // regeneration reads the stored request, so it has to follow the edited metadata
        paper.setRequest(paper.getRequest().withMetadata(paper.getSubject(), paper.getDepartment(),
                paper.getSection(), paper.getYear(), paper.getExamDate(), paper.getExamType()));
    }

    private void warnOnDrift(UUID paperId, DistributionTargets targets, DistributionSummary realized) {
        if (targets.totalQuestions() != realized.totalQuestions() || targets.totalMarks() != realized.totalMarks()) {
            log.warn("Paper {} content differs from its targets: expected {} questions / {} marks, got {} / {}",
                    paperId, targets.totalQuestions(), targets.totalMarks(),
                    realized.totalQuestions(), realized.totalMarks());
        }
    }

    private static String normalizeFilter(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    private static void requireOwner(String ownerId) {
        if (!StringUtils.hasText(ownerId)) {
            throw new ValidationException("Owner id is required");
        }
    }
}
