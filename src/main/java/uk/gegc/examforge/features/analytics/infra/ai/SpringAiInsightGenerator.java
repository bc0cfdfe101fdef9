package uk.gegc.examforge.features.analytics.infra.ai;

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
import uk.gegc.examforge.features.analytics.api.dto.PaperSummary;
import uk.gegc.examforge.features.analytics.application.GeneratedInsights;
import uk.gegc.examforge.features.analytics.application.InsightGenerator;
import uk.gegc.examforge.shared.exception.GenerationException;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SpringAiInsightGenerator implements InsightGenerator {

    private static final String SYSTEM_PROMPT = """
            You are an educational analytics expert reviewing statistics about approved exam papers.
            Answer the user's question using only the statistics provided.

            Respond with valid JSON only, in exactly this shape:
            {
              "analysis": "direct answer to the question",
              "insights": ["observation", "..."],
              "suggestions": ["actionable recommendation", "..."]
            }
            """;

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;

    @Override
    public GeneratedInsights generate(PaperSummary context, String customPrompt) {
        String statistics;
        try {
            statistics = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new GenerationException("Failed to serialize paper statistics", e);
        }

        String userPrompt = "Statistics:\n" + statistics + "\n\nQuestion: " + customPrompt;
        String raw;
        try {
            ChatResponse response = chatClient.prompt(new Prompt(List.of(
                            new SystemMessage(SYSTEM_PROMPT),
                            new UserMessage(userPrompt))))
                    .call()
                    .chatResponse();
            if (response == null || response.getResult() == null) {
                throw new GenerationException("No response received from the model");
            }
            raw = response.getResult().getOutput().getText();
        } catch (GenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new GenerationException("Model call failed: " + e.getMessage(), e);
        }

        if (!StringUtils.hasText(raw)) {
            throw new GenerationException("Empty response received from the model");
        }
        return parse(raw);
    }

    GeneratedInsights parse(String raw) {
        String cleaned = stripFences(raw);
        try {
            JsonNode root = objectMapper.readTree(cleaned);
            if (root == null || !root.isObject()) {
                return new GeneratedInsights(cleaned, List.of(), List.of());
            }
            String analysis = root.hasNonNull("analysis") ? root.get("analysis").asText() : cleaned;
            return new GeneratedInsights(analysis, textList(root.get("insights")), textList(root.get("suggestions")));
        } catch (JsonProcessingException e) {
            // free text is still a usable answer
            log.debug("Insight response is not JSON, using it verbatim: {}", e.getOriginalMessage());
            return new GeneratedInsights(cleaned, List.of(), List.of());
        }
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(item -> {
                if (StringUtils.hasText(item.asText())) {
                    values.add(item.asText().trim());
                }
            });
        }
        return values;
    }

    private static String stripFences(String response) {
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
}
