package uk.gegc.examforge.features.paper.application;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.examforge.features.paper.domain.model.CognitiveLevel;
import uk.gegc.examforge.features.paper.domain.model.GenerationRequest;
import uk.gegc.examforge.features.paper.domain.model.Paper;
import uk.gegc.examforge.features.paper.domain.model.Question;
import uk.gegc.examforge.features.paper.domain.model.QuestionSpec;

import java.util.stream.Collectors;

/**
 * Builds the instruction text handed to the generation service.
 */
@Component
public class GenerationPromptBuilder {

    public String buildInitialPrompt(GenerationRequest request) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Generate a ").append(request.examType()).append(" exam paper for ")
                .append(request.subject()).append(" (").append(request.department()).append(")")
                .append(" with the following specifications:\n\n");

        prompt.append("QUESTION DISTRIBUTION:\n");
        for (QuestionSpec spec : request.categories()) {
            if (spec.count() == 0) {
                continue;
            }
            prompt.append("- ").append(spec.category().getDisplayName()).append(": ")
                    .append(spec.count()).append(" questions x ").append(spec.marksEach())
                    .append(" marks = ").append(spec.categoryMarks()).append(" marks\n");
        }
        prompt.append("TOTAL: ").append(request.totalQuestions()).append(" questions, ")
                .append(request.totalMarks()).append(" marks\n\n");

        prompt.append("QUESTION SOURCE REQUIREMENTS:\n")
                .append("- ").append(request.provenance().previousPercent())
                .append("% from previous year papers (use similar questions from past papers)\n")
                .append("- ").append(request.provenance().creativePercent())
                .append("% creative/modified (modify existing questions creatively)\n")
                .append("- ").append(request.provenance().newPercent())
                .append("% new (create completely new questions)\n\n");

        prompt.append("BLOOM'S TAXONOMY DISTRIBUTION:\n");
        for (QuestionSpec spec : request.categories()) {
            if (spec.count() == 0) {
                continue;
            }
            prompt.append("- ").append(spec.category().getDisplayName()).append(": ")
                    .append(spec.category().getSuggestedLevels().stream()
                            .map(CognitiveLevel::getDisplayName)
                            .collect(Collectors.joining(", ")))
                    .append(" levels\n");
        }
        prompt.append('\n');

        if (StringUtils.hasText(request.topicFocus())) {
            prompt.append("TOPIC FOCUS: ").append(request.topicFocus().trim()).append("\n\n");
        } else {
            prompt.append("Cover all major topics from the syllabus\n\n");
        }

        prompt.append("IMPORTANT:\n")
                .append("- MCQ questions must list exactly four options\n")
                .append("- Ensure all questions are relevant to the subject\n")
                .append("- Maintain academic standards\n")
                .append("- No duplicate questions\n");
        return prompt.toString();
    }

    /**
     * Wraps the initial prompt for the paper's stored request with the exact question count and marks it must keep, plus a
     * short summary of the content being replaced.
     */
    public String buildRegenerationPrompt(Paper paper, String feedbackPrompt) {
        GenerationRequest request = paper.getRequest();
        int questionCount = request.totalQuestions();
        int totalMarks = request.totalMarks();
        int previousMarks = paper.getQuestions().stream().mapToInt(Question::marks).sum();

        StringBuilder prompt = new StringBuilder();
        prompt.append("CRITICAL REQUIREMENTS (MUST BE FOLLOWED EXACTLY):\n")
                .append("- Total Marks: ").append(totalMarks).append(" (EXACT)\n")
                .append("- Number of Questions: ").append(questionCount).append(" (EXACT)\n")
                .append("- Subject: ").append(paper.getSubject()).append('\n')
                .append("- Department: ").append(paper.getDepartment()).append("\n\n");

        prompt.append("ORIGINAL INSTRUCTIONS (FOLLOW STRICTLY):\n")
                .append(buildInitialPrompt(request))
                .append("\n\n");

        prompt.append("PREVIOUS GENERATION SUMMARY:\n")
                .append("- Generated ").append(paper.getQuestions().size()).append(" questions with ")
                .append(previousMarks).append(" marks\n")
                .append("- Question types used: ")
                .append(paper.getQuestions().stream()
                        .map(q -> q.category().name())
                        .distinct().sorted()
                        .collect(Collectors.joining(", ")))
                .append('\n')
                .append("- Bloom's levels: ")
                .append(paper.getQuestions().stream()
                        .map(q -> q.cognitiveLevel().name())
                        .distinct().sorted()
                        .collect(Collectors.joining(", ")))
                .append('\n');

        if (StringUtils.hasText(feedbackPrompt)) {
            prompt.append("\nREGENERATION FEEDBACK (apply while keeping the requirements above):\n")
                    .append(feedbackPrompt.trim()).append("\n\n")
                    .append("Apply the feedback but still generate EXACTLY ").append(questionCount)
                    .append(" questions with EXACTLY ").append(totalMarks).append(" marks total.\n");
        } else {
            prompt.append("\nREGENERATION GOAL: generate a fresh set of ").append(questionCount)
                    .append(" questions with ").append(totalMarks)
                    .append(" marks, maintaining quality and variety.\n");
        }
        return prompt.toString();
    }
}
