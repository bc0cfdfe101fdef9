package uk.gegc.examforge.features.paper.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.examforge.features.distribution.application.DistributionCalculator;
import uk.gegc.examforge.features.distribution.domain.model.DistributionTargets;
import uk.gegc.examforge.features.history.application.HistoryLedger;
import uk.gegc.examforge.features.history.domain.model.HistoryKind;
import uk.gegc.examforge.features.paper.application.GenerationPromptBuilder;
import uk.gegc.examforge.features.paper.application.GenerationService;
import uk.gegc.examforge.features.paper.application.PaperGenerationFacade;
import uk.gegc.examforge.features.paper.application.PaperLifecycleService;
import uk.gegc.examforge.features.paper.application.PaperMetrics;
import uk.gegc.examforge.features.paper.domain.model.GenerationRequest;
import uk.gegc.examforge.features.paper.domain.model.Paper;
import uk.gegc.examforge.features.paper.domain.model.Question;
import uk.gegc.examforge.shared.concurrency.ExternalCallRunner;
import uk.gegc.examforge.shared.config.ExamProperties;
import uk.gegc.examforge.shared.exception.GenerationException;
import uk.gegc.examforge.shared.exception.ResourceNotFoundException;
import uk.gegc.examforge.shared.exception.ValidationException;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaperGenerationFacadeImpl implements PaperGenerationFacade {

    private final DistributionCalculator distributionCalculator;
    private final GenerationPromptBuilder promptBuilder;
    private final HistoryLedger historyLedger;
    private final GenerationService generationService;
    private final PaperLifecycleService paperLifecycleService;
    private final ExternalCallRunner externalCallRunner;
    private final ExamProperties examProperties;
    private final PaperMetrics paperMetrics;

    @Override
    public Paper generate(String ownerId, GenerationRequest request) {
        // invalid requests are rejected before anything is recorded
        DistributionTargets targets = distributionCalculator.computeTargets(request);
        int maxQuestions = examProperties.getGeneration().getMaxQuestions();
        if (targets.totalQuestions() > maxQuestions) {
            throw new ValidationException("A paper may hold at most " + maxQuestions + " questions, requested "
                    + targets.totalQuestions());
        }

        String prompt = promptBuilder.buildInitialPrompt(request);
        UUID entryId = historyLedger.open(ownerId, HistoryKind.GENERATION, request, prompt, null, null);
        log.info("Generating {} paper for owner {}: {} questions, {} marks",
                request.subject(), ownerId, targets.totalQuestions(), targets.totalMarks());

        Paper paper;
        try {
            List<Question> questions = externalCallRunner.call("Generation of " + request.subject() + " paper",
                    Duration.ofSeconds(examProperties.getGeneration().getTimeoutSeconds()),
                    GenerationException.class, GenerationException::new,
                    () -> generationService.generate(request, prompt, null));
            if (questions == null || questions.isEmpty()) {
                throw new GenerationException("Generation service returned no questions");
            }
            paper = paperLifecycleService.create(ownerId, request, questions, prompt);
        } catch (RuntimeException e) {
            try {
                historyLedger.fail(entryId, e.getMessage());
            } catch (RuntimeException ledgerFailure) {
                log.warn("Could not record failure on history entry {}: {}", entryId, ledgerFailure.getMessage());
                e.addSuppressed(ledgerFailure);
            }
            paperMetrics.failure("generate");
            log.error("Generation for owner {} failed: {}", ownerId, e.getMessage());
            throw e;
        }

        // the paper is stored at this point, a missing ledger entry must not turn it into a failure
        try {
            historyLedger.complete(entryId, paper.getId());
        } catch (ResourceNotFoundException e) {
            log.warn("History entry {} was removed before paper {} could be recorded on it", entryId, paper.getId());
        }
        paperMetrics.success("generate");
        return paper;
    }
}
