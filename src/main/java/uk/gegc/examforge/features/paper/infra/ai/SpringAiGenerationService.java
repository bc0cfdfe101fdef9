package uk.gegc.examforge.features.paper.infra.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.examforge.features.distribution.application.DistributionCalculator;
import uk.gegc.examforge.features.paper.application.GenerationService;
import uk.gegc.examforge.features.paper.domain.model.CognitiveLevel;
import uk.gegc.examforge.features.paper.domain.model.Difficulty;
import uk.gegc.examforge.features.paper.domain.model.GenerationRequest;
import uk.gegc.examforge.features.paper.domain.model.Provenance;
import uk.gegc.examforge.features.paper.domain.model.Question;
import uk.gegc.examforge.features.paper.domain.model.QuestionCategory;
import uk.gegc.examforge.features.paper.domain.model.QuestionSpec;
import uk.gegc.examforge.shared.exception.GenerationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Generation service backed by a chat model. One call per attempt; retries are left to the user.
 *
 * <p>The model is asked for JSON only. Category, Bloom level and difficulty are parsed leniently;
 * provenance is not trusted from the model and is assigned positionally from the requested ratio.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpringAiGenerationService implements GenerationService {

    private static final String SYSTEM_PROMPT = """
            You are an experienced university examiner writing exam questions.

            CRITICAL: respond with valid JSON only, no markdown and no commentary, in exactly this shape:
            {
              "questions": [
                {
                  "text": "question text",
                  "answer": "model answer or correct option",
                  "explanation": "short marking note",
                  "category": "MCQ | SHORT | MEDIUM | LONG",
                  "bloomsLevel": "Remember | Understand | Apply | Analyze | Evaluate | Create",
                  "marks": 5,
                  "unit": "syllabus unit or topic",
                  "options": ["A) ...", "B) ...", "C) ...", "D) ..."],
                  "difficulty": "EASY | MEDIUM | HARD"
                }
              ]
            }
            "options" is required for MCQ questions and must be omitted otherwise.
            """;

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final DistributionCalculator distributionCalculator;

    @Override
    public List<Question> generate(GenerationRequest request, String prompt, String feedbackPrompt) {
        if (!StringUtils.hasText(prompt)) {
            throw new GenerationException("Generation prompt cannot be empty");
        }
        log.debug("Sending generation request for {} ({} questions)", request.subject(), request.totalQuestions());

        String rawResponse;
        try {
            ChatResponse response = chatClient.prompt(new Prompt(List.of(
                            new SystemMessage(SYSTEM_PROMPT),
                            new UserMessage(prompt))))
                    .call()
                    .chatResponse();
            if (response == null || response.getResult() == null) {
                throw new GenerationException("No response received from the model");
            }
            rawResponse = response.getResult().getOutput().getText();
        } catch (GenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new GenerationException("Model call failed: " + e.getMessage(), e);
        }

        if (!StringUtils.hasText(rawResponse)) {
            throw new GenerationException("Empty response received from the model");
        }

        List<Question> questions = parseQuestions(rawResponse, request);
        log.info("Model returned {} questions for {}", questions.size(), request.subject());
        return questions;
    }

    List<Question> parseQuestions(String rawResponse, GenerationRequest request) {
        JsonNode questionsNode;
        try {
            JsonNode root = objectMapper.readTree(cleanJsonResponse(rawResponse));
            questionsNode = root.isArray() ? root : root.get("questions");
        } catch (JsonProcessingException e) {
            throw new GenerationException("Model response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (questionsNode == null || !questionsNode.isArray() || questionsNode.isEmpty()) {
            throw new GenerationException("Model response contains no questions");
        }

        List<Provenance> provenance = distributionCalculator.provenanceSequence(questionsNode.size(), request.provenance());
        List<Question> questions = new ArrayList<>(questionsNode.size());
        int index = 0;
        for (JsonNode node : questionsNode) {
            String text = textOrNull(node, "text");
            if (!StringUtils.hasText(text)) {
                log.warn("Skipping question {} without text", index + 1);
                index++;
                continue;
            }
            QuestionCategory category = parseCategory(textOrNull(node, "category"));
            CognitiveLevel level = parseLevel(textOrNull(node, "bloomsLevel"), category);
            int marks = node.path("marks").canConvertToInt() && node.path("marks").asInt() > 0
                    ? node.path("marks").asInt()
                    : request.specFor(category).map(QuestionSpec::marksEach).orElse(category.getDefaultMarks());

            List<String> options = new ArrayList<>();
            if (node.path("options").isArray()) {
                node.path("options").forEach(option -> options.add(option.asText()));
            }

            questions.add(new Question(
                    text.trim(),
                    textOrNull(node, "answer"),
                    textOrNull(node, "explanation"),
                    category,
                    level,
                    marks,
                    provenance.get(index),
                    textOrNull(node, "unit"),
                    options,
                    parseDifficulty(textOrNull(node, "difficulty"))
            ));
            index++;
        }

        if (questions.isEmpty()) {
            throw new GenerationException("No usable questions in model response");
        }
        return questions;
    }

    private String cleanJsonResponse(String response) {
        String cleaned = response.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    static QuestionCategory parseCategory(String raw) {
        if (raw == null) {
            return QuestionCategory.SHORT;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        if (normalized.contains("MCQ") || normalized.contains("MULTIPLE")) {
            return QuestionCategory.MCQ;
        }
        if (normalized.startsWith("LONG")) {
            return QuestionCategory.LONG;
        }
        if (normalized.startsWith("MEDIUM")) {
            return QuestionCategory.MEDIUM;
        }
        return QuestionCategory.SHORT;
    }

    static CognitiveLevel parseLevel(String raw, QuestionCategory category) {
        if (raw != null) {
            String normalized = raw.trim().toUpperCase(Locale.ROOT).replace("ANALYSE", "ANALYZE");
            for (CognitiveLevel level : CognitiveLevel.values()) {
                if (normalized.startsWith(level.name())) {
                    return level;
                }
            }
        }
        return category.getSuggestedLevels().get(0);
    }

    static Difficulty parseDifficulty(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Difficulty.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring unknown difficulty '{}'", raw);
            return null;
        }
    }
}
