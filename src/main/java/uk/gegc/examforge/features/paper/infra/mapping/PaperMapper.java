package uk.gegc.examforge.features.paper.infra.mapping;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.examforge.features.distribution.application.DistributionCalculator;
import uk.gegc.examforge.features.distribution.domain.model.DistributionSummary;
import uk.gegc.examforge.features.paper.api.dto.ArtifactLinksDto;
import uk.gegc.examforge.features.paper.api.dto.DistributionDto;
import uk.gegc.examforge.features.paper.api.dto.GeneratePaperRequest;
import uk.gegc.examforge.features.paper.api.dto.PaperDto;
import uk.gegc.examforge.features.paper.api.dto.PaperSummaryDto;
import uk.gegc.examforge.features.paper.api.dto.ProvenanceRequest;
import uk.gegc.examforge.features.paper.api.dto.QuestionDto;
import uk.gegc.examforge.features.paper.api.dto.QuestionSpecRequest;
import uk.gegc.examforge.features.paper.api.dto.UpdatePaperMetadataRequest;
import uk.gegc.examforge.features.paper.domain.model.ApprovedArtifacts;
import uk.gegc.examforge.features.paper.domain.model.GenerationRequest;
import uk.gegc.examforge.features.paper.domain.model.Paper;
import uk.gegc.examforge.features.paper.domain.model.PaperMetadataUpdate;
import uk.gegc.examforge.features.paper.domain.model.ProvenanceRatio;
import uk.gegc.examforge.features.paper.domain.model.Question;
import uk.gegc.examforge.features.paper.domain.model.QuestionSpec;

import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
public class PaperMapper {

    private static final String ARTIFACT_PATH = "/api/v1/artifacts/";

    private final DistributionCalculator distributionCalculator;

    public GenerationRequest toGenerationRequest(GeneratePaperRequest request) {
        List<QuestionSpec> categories = new ArrayList<>();
        for (QuestionSpecRequest spec : request.categories()) {
            int marksEach = spec.marksEach() != null ? spec.marksEach() : spec.category().getDefaultMarks();
            categories.add(new QuestionSpec(spec.category(), spec.count(), marksEach));
        }
        return new GenerationRequest(
                request.subject().trim(),
                request.department().trim(),
                request.section(),
                request.year(),
                request.examDate(),
                request.examType(),
                request.topicFocus(),
                categories,
                toRatio(request.provenance())
        );
    }

    public PaperMetadataUpdate toMetadataUpdate(UpdatePaperMetadataRequest request) {
        if (request == null) {
            return new PaperMetadataUpdate(null, null, null, null, null, null, null);
        }
        return new PaperMetadataUpdate(
                request.subject(),
                request.department(),
                request.section(),
                request.year(),
                request.examDate(),
                request.totalMarks(),
                request.examType()
        );
    }

    public PaperDto toDto(Paper paper) {
        List<Question> questions = paper.getQuestions();
        List<QuestionDto> questionDtos = new ArrayList<>(questions.size());
        for (int i = 0; i < questions.size(); i++) {
            questionDtos.add(toQuestionDto(i + 1, questions.get(i)));
        }
        return new PaperDto(
                paper.getId(),
                paper.getSubject(),
                paper.getDepartment(),
                paper.getSection(),
                paper.getYear(),
                paper.getExamDate(),
                paper.getExamType(),
                paper.getTotalMarks(),
                paper.getStatus(),
                paper.getRegenerationCount(),
                paper.isEditCopy(),
                paper.getSourcePaperId(),
                toLinks(paper.getApprovedArtifacts()),
                paper.getApprovedAt(),
                paper.getGenerationPrompt(),
                questionDtos,
                toDistributionDto(paper.getDistributionSummary()),
                paper.getCreatedAt(),
                paper.getUpdatedAt(),
                paper.getVersion()
        );
    }

    public PaperSummaryDto toSummaryDto(Paper paper) {
        return new PaperSummaryDto(
                paper.getId(),
                paper.getSubject(),
                paper.getDepartment(),
                paper.getSection(),
                paper.getYear(),
                paper.getExamType(),
                paper.getTotalMarks(),
                paper.getQuestions().size(),
                paper.getStatus(),
                paper.getRegenerationCount(),
                paper.isEditCopy(),
                paper.getSourcePaperId(),
                toLinks(paper.getApprovedArtifacts()),
                paper.getApprovedAt(),
                paper.getCreatedAt()
        );
    }

    public DistributionDto toDistributionDto(DistributionSummary summary) {
        return new DistributionDto(
                summary.totalQuestions(),
                summary.totalMarks(),
                summary.byCategory(),
                summary.marksByCategory(),
                summary.byCognitiveLevel(),
                summary.byProvenance(),
                summary.byCognitiveLevelAndProvenance(),
                distributionCalculator.percentages(summary.byCognitiveLevel(), summary.totalQuestions()),
                distributionCalculator.percentages(summary.byProvenance(), summary.totalQuestions())
        );
    }

    private QuestionDto toQuestionDto(int number, Question question) {
        return new QuestionDto(
                number,
                question.text(),
                question.answerKey(),
                question.explanation(),
                question.category(),
                question.cognitiveLevel(),
                question.marks(),
                question.provenance(),
                question.unit(),
                question.options(),
                question.difficulty()
        );
    }

    private ArtifactLinksDto toLinks(ApprovedArtifacts artifacts) {
        if (artifacts == null) {
            return null;
        }
        return new ArtifactLinksDto(
                artifacts.getQuestionPaperArtifactId(),
                ARTIFACT_PATH + artifacts.getQuestionPaperArtifactId(),
                artifacts.getAnswerKeyArtifactId(),
                ARTIFACT_PATH + artifacts.getAnswerKeyArtifactId()
        );
    }

    private static ProvenanceRatio toRatio(ProvenanceRequest provenance) {
        if (provenance == null) {
            return ProvenanceRatio.DEFAULT;
        }
        return new ProvenanceRatio(provenance.previousPercent(), provenance.creativePercent(), provenance.newPercent());
    }
}
