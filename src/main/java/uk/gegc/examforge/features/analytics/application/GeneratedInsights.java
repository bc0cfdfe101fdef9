package uk.gegc.examforge.features.analytics.application;

import java.util.List;

/**
 * Output of an {@link InsightGenerator}: free-text analysis plus optional bullet points.
 */
public record GeneratedInsights(String analysis, List<String> insights, List<String> suggestions) {

    public GeneratedInsights {
        insights = insights == null ? List.of() : List.copyOf(insights);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
