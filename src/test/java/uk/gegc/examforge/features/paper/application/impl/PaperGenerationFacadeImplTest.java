package uk.gegc.examforge.features.paper.application.impl;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import uk.gegc.examforge.BaseUnitTest;
import uk.gegc.examforge.features.distribution.application.DistributionCalculator;
import uk.gegc.examforge.features.history.application.HistoryLedger;
import uk.gegc.examforge.features.history.domain.model.HistoryKind;
import uk.gegc.examforge.features.paper.application.GenerationPromptBuilder;
import uk.gegc.examforge.features.paper.application.GenerationService;
import uk.gegc.examforge.features.paper.application.PaperLifecycleService;
import uk.gegc.examforge.features.paper.application.PaperMetrics;
import uk.gegc.examforge.features.paper.domain.model.GenerationRequest;
import uk.gegc.examforge.features.paper.domain.model.Paper;
import uk.gegc.examforge.features.paper.domain.model.ProvenanceRatio;
import uk.gegc.examforge.features.paper.domain.model.QuestionCategory;
import uk.gegc.examforge.features.paper.domain.model.QuestionSpec;
import uk.gegc.examforge.shared.concurrency.ExternalCallRunner;
import uk.gegc.examforge.shared.config.ExamProperties;
import uk.gegc.examforge.shared.exception.GenerationException;
import uk.gegc.examforge.shared.exception.ResourceNotFoundException;
import uk.gegc.examforge.shared.exception.ValidationException;
import uk.gegc.examforge.support.TestPapers;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static uk.gegc.examforge.support.TestPapers.OWNER;

class PaperGenerationFacadeImplTest extends BaseUnitTest {

    @Mock
    private HistoryLedger historyLedger;
    @Mock
    private GenerationService generationService;
    @Mock
    private PaperLifecycleService paperLifecycleService;

    private final ExamProperties examProperties = new ExamProperties();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private ThreadPoolTaskExecutor executor;
    private PaperGenerationFacadeImpl facade;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.initialize();
        facade = new PaperGenerationFacadeImpl(new DistributionCalculator(), new GenerationPromptBuilder(),
                historyLedger, generationService, paperLifecycleService, new ExternalCallRunner(executor),
                examProperties, new PaperMetrics(meterRegistry));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("generate: success creates the draft and completes the history entry")
    void generate_success_completesEntry() {
        GenerationRequest request = TestPapers.request();
        UUID entryId = UUID.randomUUID();
        Paper created = TestPapers.draft();
        when(historyLedger.open(eq(OWNER), eq(HistoryKind.GENERATION), eq(request), contains("QUESTION DISTRIBUTION"),
                isNull(), isNull())).thenReturn(entryId);
        when(generationService.generate(eq(request), anyString(), isNull())).thenReturn(TestPapers.questions());
        when(paperLifecycleService.create(eq(OWNER), eq(request), eq(TestPapers.questions()), anyString()))
                .thenReturn(created);

        Paper result = facade.generate(OWNER, request);

        assertThat(result).isSameAs(created);
        verify(historyLedger).complete(entryId, created.getId());
        verify(historyLedger, never()).fail(any(), any());
        assertThat(meterRegistry.counter("exam.papers.operations", "operation", "generate", "outcome", "success")
                .count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("generate: invalid request is rejected before a history entry is opened")
    void generate_invalidRatio_noHistory() {
        GenerationRequest request = new GenerationRequest("Maths", "Science", null, null, null, null, null,
                List.of(new QuestionSpec(QuestionCategory.MCQ, 10, 1)), new ProvenanceRatio(30, 30, 30));

        assertThatThrownBy(() -> facade.generate(OWNER, request)).isInstanceOf(ValidationException.class);
        verifyNoInteractions(historyLedger, generationService, paperLifecycleService);
    }

    @Test
    @DisplayName("generate: requests above the question cap are rejected")
    void generate_tooManyQuestions_rejected() {
        examProperties.getGeneration().setMaxQuestions(2);

        assertThatThrownBy(() -> facade.generate(OWNER, TestPapers.request()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("at most 2");
        verifyNoInteractions(historyLedger);
    }

    @Test
    @DisplayName("generate: generation failure fails the history entry and creates nothing")
    void generate_serviceFails_failsEntry() {
        UUID entryId = UUID.randomUUID();
        when(historyLedger.open(any(), any(), any(), any(), any(), any())).thenReturn(entryId);
        when(generationService.generate(any(), anyString(), any())).thenThrow(new GenerationException("quota exceeded"));

        assertThatThrownBy(() -> facade.generate(OWNER, TestPapers.request()))
                .isInstanceOf(GenerationException.class)
                .hasMessage("quota exceeded");

        verify(historyLedger).fail(entryId, "quota exceeded");
        verifyNoInteractions(paperLifecycleService);
    }

    @Test
    @DisplayName("generate: unexpected collaborator error is wrapped as a generation failure")
    void generate_unexpectedError_wrapped() {
        UUID entryId = UUID.randomUUID();
        when(historyLedger.open(any(), any(), any(), any(), any(), any())).thenReturn(entryId);
        when(generationService.generate(any(), anyString(), any())).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> facade.generate(OWNER, TestPapers.request()))
                .isInstanceOf(GenerationException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        verify(historyLedger).fail(eq(entryId), contains("boom"));
    }

    @Test
    @DisplayName("generate: a history entry deleted mid-flight does not hide the generation failure")
    void generate_entryDeletedDuringFailure_originalErrorSurfaces() {
        UUID entryId = UUID.randomUUID();
        when(historyLedger.open(any(), any(), any(), any(), any(), any())).thenReturn(entryId);
        when(generationService.generate(any(), anyString(), any())).thenThrow(new GenerationException("quota exceeded"));
        doThrow(new ResourceNotFoundException("No in-progress history entry " + entryId))
                .when(historyLedger).fail(eq(entryId), anyString());

        assertThatThrownBy(() -> facade.generate(OWNER, TestPapers.request()))
                .isInstanceOf(GenerationException.class)
                .hasMessage("quota exceeded")
                .satisfies(e -> assertThat(e.getSuppressed())
                        .hasOnlyElementsOfType(ResourceNotFoundException.class)
                        .hasSize(1));
    }

    @Test
    @DisplayName("generate: the stored paper is returned even when its history entry was deleted")
    void generate_entryDeletedBeforeCompletion_returnsPaper() {
        UUID entryId = UUID.randomUUID();
        Paper created = TestPapers.draft();
        when(historyLedger.open(any(), any(), any(), any(), any(), any())).thenReturn(entryId);
        when(generationService.generate(any(), anyString(), any())).thenReturn(TestPapers.questions());
        when(paperLifecycleService.create(eq(OWNER), any(), any(), anyString())).thenReturn(created);
        doThrow(new ResourceNotFoundException("No in-progress history entry " + entryId))
                .when(historyLedger).complete(entryId, created.getId());

        Paper result = facade.generate(OWNER, TestPapers.request());

        assertThat(result).isSameAs(created);
        verify(historyLedger, never()).fail(any(), any());
        assertThat(meterRegistry.counter("exam.papers.operations", "operation", "generate", "outcome", "success")
                .count()).isEqualTo(1.0);
    }
}
