package uk.gegc.examforge.features.paper.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.examforge.features.distribution.application.DistributionCalculator;
import uk.gegc.examforge.features.paper.application.PaperGenerationFacade;
import uk.gegc.examforge.features.paper.application.PaperLifecycleService;
import uk.gegc.examforge.features.paper.domain.model.ApprovedArtifacts;
import uk.gegc.examforge.features.paper.domain.model.GenerationRequest;
import uk.gegc.examforge.features.paper.domain.model.Paper;
import uk.gegc.examforge.features.paper.domain.model.PaperMetadataUpdate;
import uk.gegc.examforge.features.paper.domain.model.PaperStatus;
import uk.gegc.examforge.features.paper.domain.model.ProvenanceRatio;
import uk.gegc.examforge.features.paper.domain.model.QuestionCategory;
import uk.gegc.examforge.features.paper.infra.mapping.PaperMapper;
import uk.gegc.examforge.shared.api.OwnerHeader;
import uk.gegc.examforge.shared.exception.ConflictException;
import uk.gegc.examforge.shared.exception.GenerationException;
import uk.gegc.examforge.shared.exception.InvalidStateException;
import uk.gegc.examforge.shared.exception.ResourceNotFoundException;
import uk.gegc.examforge.shared.exception.ValidationException;
import uk.gegc.examforge.support.TestPapers;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentCaptor.forClass;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static uk.gegc.examforge.support.TestPapers.OWNER;

@WebMvcTest(PaperController.class)
@Import({PaperMapper.class, DistributionCalculator.class})
class PaperControllerTest {

    private static final String GENERATE_BODY = """
            {
              "subject": " Physics ",
              "department": "Science",
              "examType": "MID",
              "examDate": "2024-06-01",
              "categories": [
                {"category": "MCQ", "count": 10},
                {"category": "SHORT", "count": 5, "marksEach": 3}
              ],
              "provenance": {"previousPercent": 50, "creativePercent": 0, "newPercent": 50}
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PaperGenerationFacade paperGenerationFacade;

    @MockitoBean
    private PaperLifecycleService paperLifecycleService;

    @Test
    @DisplayName("POST /api/v1/papers/generate: valid request returns 201 with the draft")
    void generate_validRequest_returns201() throws Exception {
        Paper draft = TestPapers.draft();
        when(paperGenerationFacade.generate(eq(OWNER), any(GenerationRequest.class))).thenReturn(draft);

        mockMvc.perform(post("/api/v1/papers/generate")
                        .header(OwnerHeader.NAME, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GENERATE_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(draft.getId().toString()))
                .andExpect(jsonPath("$.status").value("DRAFT"))
                .andExpect(jsonPath("$.questions.length()").value(3))
                .andExpect(jsonPath("$.questions[0].number").value(1))
                .andExpect(jsonPath("$.distribution.totalQuestions").value(3));

        var captor = forClass(GenerationRequest.class);
        verify(paperGenerationFacade).generate(eq(OWNER), captor.capture());
        GenerationRequest request = captor.getValue();
        assertThat(request.subject()).isEqualTo("Physics");
        assertThat(request.provenance()).isEqualTo(new ProvenanceRatio(50, 0, 50));
        assertThat(request.specFor(QuestionCategory.MCQ).orElseThrow().marksEach())
                .isEqualTo(QuestionCategory.MCQ.getDefaultMarks());
        assertThat(request.totalMarks()).isEqualTo(25);
    }

    @Test
    @DisplayName("POST /api/v1/papers/generate: blank subject returns 400 with field errors")
    void generate_blankSubject_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/papers/generate")
                        .header(OwnerHeader.NAME, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GENERATE_BODY.replace("\" Physics \"", "\"\"")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors[0].field").value("subject"));

        verifyNoInteractions(paperGenerationFacade);
    }

    @Test
    @DisplayName("POST /api/v1/papers/generate: oversized marks per question returns 400")
    void generate_hugeMarksEach_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/papers/generate")
                        .header(OwnerHeader.NAME, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GENERATE_BODY.replace("\"marksEach\": 3", "\"marksEach\": 2147483647")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors[0].field").value("categories[1].marksEach"));

        verifyNoInteractions(paperGenerationFacade);
    }

    @Test
    @DisplayName("POST /api/v1/papers/generate: bad provenance ratio returns 400")
    void generate_badRatio_returns400() throws Exception {
        when(paperGenerationFacade.generate(eq(OWNER), any()))
                .thenThrow(new ValidationException("Provenance percentages must sum to 100, got 90"));

        mockMvc.perform(post("/api/v1/papers/generate")
                        .header(OwnerHeader.NAME, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GENERATE_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation Failed"))
                .andExpect(jsonPath("$.detail").value("Provenance percentages must sum to 100, got 90"));
    }

    @Test
    @DisplayName("POST /api/v1/papers/generate: generation failure returns 502")
    void generate_generationFails_returns502() throws Exception {
        when(paperGenerationFacade.generate(eq(OWNER), any()))
                .thenThrow(new GenerationException("Generation of Physics paper timed out after 180s"));

        mockMvc.perform(post("/api/v1/papers/generate")
                        .header(OwnerHeader.NAME, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GENERATE_BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.title").value("Generation Failed"));
    }

    @Test
    @DisplayName("GET /api/v1/papers/{id}: missing owner header returns 400")
    void get_missingOwnerHeader_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/papers/{id}", UUID.randomUUID()))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(paperLifecycleService);
    }

    @Test
    @DisplayName("GET /api/v1/papers/{id}: unknown paper returns 404")
    void get_unknown_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(paperLifecycleService.get(OWNER, id)).thenThrow(new ResourceNotFoundException("Paper " + id + " not found"));

        mockMvc.perform(get("/api/v1/papers/{id}", id).header(OwnerHeader.NAME, OWNER))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Resource Not Found"));
    }

    @Test
    @DisplayName("GET /api/v1/papers/{id}: malformed id returns 400")
    void get_malformedId_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/papers/not-a-uuid").header(OwnerHeader.NAME, OWNER))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /api/v1/papers?status=APPROVED: lists summaries")
    void list_byStatus() throws Exception {
        Paper paper = TestPapers.draft();
        when(paperLifecycleService.list(OWNER, PaperStatus.DRAFT)).thenReturn(List.of(paper));

        mockMvc.perform(get("/api/v1/papers").param("status", "DRAFT").header(OwnerHeader.NAME, OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(paper.getId().toString()))
                .andExpect(jsonPath("$[0].questionCount").value(3));
    }

    @Test
    @DisplayName("PATCH /api/v1/papers/{id}/metadata: approved paper returns 409")
    void updateMetadata_approved_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(paperLifecycleService.updateMetadata(eq(OWNER), eq(id), any(PaperMetadataUpdate.class)))
                .thenThrow(new InvalidStateException("Cannot edit metadata of paper " + id + " in status APPROVED"));

        mockMvc.perform(patch("/api/v1/papers/{id}/metadata", id)
                        .header(OwnerHeader.NAME, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subject\": \"Chemistry\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.title").value("Invalid State"));
    }

    @Test
    @DisplayName("POST /api/v1/papers/{id}/regenerate: body is optional")
    void regenerate_withoutBody_passesNullFeedback() throws Exception {
        Paper paper = TestPapers.draft();
        paper.setRegenerationCount(1);
        when(paperLifecycleService.regenerate(eq(OWNER), eq(paper.getId()), isNull())).thenReturn(paper);

        mockMvc.perform(post("/api/v1/papers/{id}/regenerate", paper.getId()).header(OwnerHeader.NAME, OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.regenerationCount").value(1));
    }

    @Test
    @DisplayName("POST /api/v1/papers/{id}/regenerate: busy lineage returns 409")
    void regenerate_busy_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(paperLifecycleService.regenerate(OWNER, id, "harder"))
                .thenThrow(new ConflictException("Paper " + id + " is being modified by another request"));

        mockMvc.perform(post("/api/v1/papers/{id}/regenerate", id)
                        .header(OwnerHeader.NAME, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"feedbackPrompt\": \"harder\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.title").value("Conflict"));
    }

    @Test
    @DisplayName("POST /api/v1/papers/{id}/approve: returns artifact links")
    void approve_returnsArtifacts() throws Exception {
        Paper paper = TestPapers.draft();
        UUID questionsId = UUID.randomUUID();
        paper.approve(new ApprovedArtifacts(questionsId, UUID.randomUUID()), Instant.parse("2024-01-02T00:00:00Z"));
        when(paperLifecycleService.approve(OWNER, paper.getId())).thenReturn(paper);

        mockMvc.perform(post("/api/v1/papers/{id}/approve", paper.getId()).header(OwnerHeader.NAME, OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"))
                .andExpect(jsonPath("$.artifacts.questionPaperArtifactId").value(questionsId.toString()));
    }

    @Test
    @DisplayName("POST /api/v1/papers/{id}/approve: stale version returns 409 with error code")
    void approve_staleVersion_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(paperLifecycleService.approve(OWNER, id)).thenThrow(new OptimisticLockingFailureException("stale"));

        mockMvc.perform(post("/api/v1/papers/{id}/approve", id).header(OwnerHeader.NAME, OWNER))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("PAPER_VERSION_CONFLICT"));
    }

    @Test
    @DisplayName("POST /api/v1/papers/{id}/edit-copy: returns 201 with the new draft")
    void editCopy_returns201() throws Exception {
        UUID sourceId = UUID.randomUUID();
        Paper copy = TestPapers.draft();
        copy.setEditCopy(true);
        copy.setSourcePaperId(sourceId);
        when(paperLifecycleService.createEditCopy(OWNER, sourceId)).thenReturn(copy);

        mockMvc.perform(post("/api/v1/papers/{id}/edit-copy", sourceId).header(OwnerHeader.NAME, OWNER))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.editCopy").value(true))
                .andExpect(jsonPath("$.sourcePaperId").value(sourceId.toString()));
    }

    @Test
    @DisplayName("DELETE /api/v1/papers/{id}: returns 204")
    void delete_returns204() throws Exception {
        UUID id = UUID.randomUUID();

        mockMvc.perform(delete("/api/v1/papers/{id}", id).header(OwnerHeader.NAME, OWNER))
                .andExpect(status().isNoContent());

        verify(paperLifecycleService).delete(OWNER, id);
    }

    @Test
    @DisplayName("GET /api/v1/papers/approved: passes filters through")
    void searchApproved_passesFilters() throws Exception {
        when(paperLifecycleService.search(OWNER, "phys", null)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/papers/approved").param("subject", "phys").header(OwnerHeader.NAME, OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    @DisplayName("GET /api/v1/papers/approved/subjects: lists subjects")
    void listApprovedSubjects() throws Exception {
        when(paperLifecycleService.listApprovedSubjects(OWNER)).thenReturn(List.of("History", "Physics"));

        mockMvc.perform(get("/api/v1/papers/approved/subjects").header(OwnerHeader.NAME, OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1]").value("Physics"));
    }
}
