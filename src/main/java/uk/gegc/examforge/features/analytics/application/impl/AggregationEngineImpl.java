package uk.gegc.examforge.features.analytics.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.examforge.features.analytics.api.dto.PaperAnalysis;
import uk.gegc.examforge.features.analytics.api.dto.PaperSummary;
import uk.gegc.examforge.features.analytics.application.AggregationEngine;
import uk.gegc.examforge.features.analytics.application.GeneratedInsights;
import uk.gegc.examforge.features.analytics.application.InsightGenerator;
import uk.gegc.examforge.features.distribution.application.DistributionCalculator;
import uk.gegc.examforge.features.paper.application.PaperLifecycleService;
import uk.gegc.examforge.features.paper.domain.model.CognitiveLevel;
import uk.gegc.examforge.features.paper.domain.model.Paper;
import uk.gegc.examforge.features.paper.domain.model.Provenance;
import uk.gegc.examforge.features.paper.domain.model.Question;
import uk.gegc.examforge.features.paper.domain.model.QuestionCategory;
import uk.gegc.examforge.shared.concurrency.ExternalCallRunner;
import uk.gegc.examforge.shared.config.ExamProperties;
import uk.gegc.examforge.shared.exception.GenerationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AggregationEngineImpl implements AggregationEngine {

    static final String UNSPECIFIED = "UNSPECIFIED";

    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM");
    private static final Map<String, Integer> IDEAL_DIFFICULTY = idealDifficulty();
    private static final Comparator<String> BY_BUCKET_START =
            Comparator.comparingInt((String bucket) -> Integer.parseInt(bucket.substring(0, bucket.indexOf('-'))));

    private final DistributionCalculator distributionCalculator;
    private final PaperLifecycleService paperLifecycleService;
    private final InsightGenerator insightGenerator;
    private final ExternalCallRunner externalCallRunner;
    private final ExamProperties examProperties;
    private final Clock clock;

    @Override
    public PaperSummary summarizeApproved(String ownerId, String subject, String department, UUID paperId,
                                          String customPrompt) {
        List<Paper> approved = paperLifecycleService.search(ownerId, subject, department);
        log.debug("Summarizing {} approved papers for owner {}", approved.size(), ownerId);
        return summarize(approved, paperId, customPrompt);
    }

    @Override
    public PaperSummary summarize(Collection<Paper> papers, UUID paperId, String customPrompt) {
        List<Paper> all = papers == null ? List.of() : List.copyOf(papers);
        List<Question> questions = all.stream().flatMap(p -> p.getQuestions().stream()).toList();

        Map<String, Long> departments = sorted(distributionCalculator.countBy(all, Paper::getDepartment));
        Map<String, Long> subjects = sorted(distributionCalculator.countBy(all, Paper::getSubject));
        Map<QuestionCategory, Long> types = sorted(distributionCalculator.countBy(questions, Question::category));
        Map<CognitiveLevel, Long> blooms = sorted(distributionCalculator.countBy(questions, Question::cognitiveLevel));
        Map<Provenance, Long> provenance = sorted(distributionCalculator.countBy(questions, Question::provenance));
        Map<String, Long> difficulty = sorted(distributionCalculator.countBy(questions, AggregationEngineImpl::difficultyKey));
        Map<String, Long> marks = sorted(distributionCalculator.<Paper, String>countBy(all, p -> markBucket(p.getTotalMarks())),
                BY_BUCKET_START);
        Map<String, Long> trend = sorted(distributionCalculator.<Paper, String>countBy(all, this::monthKey));

        double averageMarks = all.isEmpty() ? 0.0 : round(all.stream().mapToLong(Paper::getTotalMarks).sum() / (double) all.size(), 2);

        List<String> insights = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        if (!all.isEmpty()) {
            analyzeTrend(trend, insights);
            analyzeTypes(types, questions.size(), insights, suggestions);
            analyzeBlooms(blooms, suggestions);
            analyzeProvenance(provenance, questions.size(), insights);
            analyzeCoverage(subjects, departments, all.size(), suggestions);
            analyzeQuestionCounts(all, questions.size(), insights, suggestions);
            analyzeDifficulty(difficulty, suggestions);
        }

        PaperAnalysis paperAnalysis = paperId == null ? null : all.stream()
                .filter(p -> paperId.equals(p.getId()))
                .findFirst()
                .map(this::analyzePaper)
                .orElse(null);

        PaperSummary summary = new PaperSummary(all.size(), questions.size(), averageMarks, departments, subjects,
                types, blooms, provenance, difficulty, marks, trend, insights, suggestions, paperAnalysis, null);

        if (StringUtils.hasText(customPrompt) && !all.isEmpty()) {
            GeneratedInsights generated = externalCallRunner.call("Custom analysis",
                    Duration.ofSeconds(examProperties.getInsights().getTimeoutSeconds()),
                    GenerationException.class, GenerationException::new,
                    () -> insightGenerator.generate(summary, customPrompt.trim()));
            return summary.withGeneratedInsights(generated.analysis(), generated.insights(), generated.suggestions());
        }
        return summary;
    }

    PaperAnalysis analyzePaper(Paper paper) {
        List<Question> questions = paper.getQuestions();
        int count = questions.size();

        Map<CognitiveLevel, Double> bloomsPct = distributionCalculator.percentages(
                sorted(distributionCalculator.countBy(questions, Question::cognitiveLevel)), count);
        Map<String, Double> difficultyPct = distributionCalculator.percentages(
                sorted(distributionCalculator.countBy(questions, AggregationEngineImpl::difficultyKey)), count);
        Map<QuestionCategory, Double> typePct = distributionCalculator.percentages(
                sorted(distributionCalculator.countBy(questions, Question::category)), count);
        Map<Provenance, Double> provenancePct = distributionCalculator.percentages(
                sorted(distributionCalculator.countBy(questions, Question::provenance)), count);

        List<PaperAnalysis.QuestionBreakdown> breakdown = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Question q = questions.get(i);
            breakdown.add(new PaperAnalysis.QuestionBreakdown(i + 1, q.category(), q.cognitiveLevel(),
                    difficultyKey(q), q.marks(), q.provenance(), q.unit()));
        }

        List<String> recommendations = new ArrayList<>();
        if (difficultyPct.getOrDefault("HARD", 0.0) > 40) {
            recommendations.add("Consider reducing the proportion of hard questions");
        }
        if (typePct.size() < 3) {
            recommendations.add("Try to include more variety in question types");
        }
        double higherOrder = bloomsPct.entrySet().stream()
                .filter(e -> e.getKey().isHigherOrder())
                .mapToDouble(Map.Entry::getValue)
                .sum();
        if (count > 0 && higherOrder < 30) {
            recommendations.add("Include more higher-order questions (Analyze, Evaluate, Create)");
        }

        double averagePerQuestion = count == 0 ? 0.0 : round(paper.getTotalMarks() / (double) count, 2);
        return new PaperAnalysis(paper.getId(), paper.getTotalMarks(), count, averagePerQuestion,
                paper.getCreatedAt(), paper.getUpdatedAt(), bloomsPct, difficultyPct, typePct, provenancePct,
                breakdown, recommendations);
    }

    private void analyzeTrend(Map<String, Long> trend, List<String> insights) {
        List<Long> counts = trend.entrySet().stream()
                .filter(e -> !UNSPECIFIED.equals(e.getKey()))
                .map(Map.Entry::getValue)
                .toList();
        List<Long> recent = counts.subList(Math.max(0, counts.size() - 3), counts.size());
        if (recent.size() < 2) {
            return;
        }
        double totalChange = 0;
        for (int i = 1; i < recent.size(); i++) {
            totalChange += (recent.get(i) - recent.get(i - 1)) * 100.0 / recent.get(i - 1);
        }
        double averageChange = totalChange / (recent.size() - 1);
        if (averageChange > 20) {
            insights.add("Paper generation has increased by " + Math.round(averageChange) + "% in recent months");
        } else if (averageChange < -20) {
            insights.add("Paper generation has decreased by " + Math.abs(Math.round(averageChange)) + "% in recent months");
        }
    }

    private void analyzeTypes(Map<QuestionCategory, Long> types, int totalQuestions, List<String> insights,
                              List<String> suggestions) {
        if (types.isEmpty()) {
            return;
        }
        QuestionCategory mostCommon = null;
        long best = -1;
        for (Map.Entry<QuestionCategory, Long> entry : types.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                mostCommon = entry.getKey();
            }
        }
        insights.add("Most frequently used question type is '" + mostCommon.getDisplayName() + "' ("
                + Math.round(best * 100.0 / totalQuestions) + "%)");
        if (types.size() < QuestionCategory.values().length) {
            suggestions.add("Consider diversifying question types to assess different skills");
        }
        if (types.values().stream().anyMatch(c -> c * 100.0 / totalQuestions > 40)) {
            suggestions.add("Try to maintain a more balanced distribution of question types");
        }
    }

    private void analyzeBlooms(Map<CognitiveLevel, Long> blooms, List<String> suggestions) {
        long higher = blooms.entrySet().stream().filter(e -> e.getKey().isHigherOrder()).mapToLong(Map.Entry::getValue).sum();
        long lower = blooms.entrySet().stream().filter(e -> !e.getKey().isHigherOrder()).mapToLong(Map.Entry::getValue).sum();
        if (higher < lower * 0.3) {
            suggestions.add("Consider including more higher-order thinking questions (Analyze, Evaluate, Create)");
        }
    }

    private void analyzeProvenance(Map<Provenance, Long> provenance, int totalQuestions, List<String> insights) {
        if (totalQuestions == 0) {
            return;
        }
        insights.add("Question sources: "
                + distributionCalculator.percentage(provenance.getOrDefault(Provenance.PREVIOUS, 0L), totalQuestions) + "% previous, "
                + distributionCalculator.percentage(provenance.getOrDefault(Provenance.CREATIVE, 0L), totalQuestions) + "% creative, "
                + distributionCalculator.percentage(provenance.getOrDefault(Provenance.NEW, 0L), totalQuestions) + "% new");
    }

    private void analyzeCoverage(Map<String, Long> subjects, Map<String, Long> departments, int totalPapers,
                                 List<String> suggestions) {
        if (subjects.size() > 1) {
            double averagePerSubject = totalPapers / (double) subjects.size();
            List<String> thinSubjects = subjects.entrySet().stream()
                    .filter(e -> e.getValue() < averagePerSubject)
                    .map(Map.Entry::getKey)
                    .toList();
            if (!thinSubjects.isEmpty()) {
                suggestions.add("Consider creating more papers for: " + String.join(", ", thinSubjects));
            }
        }
        List<String> thinDepartments = departments.entrySet().stream()
                .filter(e -> e.getValue() < totalPapers * 0.2)
                .map(Map.Entry::getKey)
                .toList();
        if (!thinDepartments.isEmpty()) {
            suggestions.add("Departments needing more coverage: " + String.join(", ", thinDepartments));
        }
    }

    private void analyzeQuestionCounts(List<Paper> papers, int totalQuestions, List<String> insights,
                                       List<String> suggestions) {
        double averagePerPaper = totalQuestions / (double) papers.size();
        if (averagePerPaper == 0) {
            return;
        }
        insights.add("Average questions per paper: " + round(averagePerPaper, 1));
        if (papers.stream().anyMatch(p -> p.getQuestions().size() < averagePerPaper * 0.7)) {
            suggestions.add("Some papers have significantly fewer questions than average");
        }
    }

    private void analyzeDifficulty(Map<String, Long> difficulty, List<String> suggestions) {
        long rated = difficulty.entrySet().stream()
                .filter(e -> !UNSPECIFIED.equals(e.getKey()))
                .mapToLong(Map.Entry::getValue)
                .sum();
        if (rated == 0) {
            return;
        }
        IDEAL_DIFFICULTY.forEach((level, idealPercent) -> {
            double actual = difficulty.getOrDefault(level, 0L) * 100.0 / rated;
            if (Math.abs(actual - idealPercent) > 15) {
                suggestions.add("Adjust " + level.charAt(0) + level.substring(1).toLowerCase() + " questions from "
                        + Math.round(actual) + "% towards " + idealPercent + "% for better balance");
            }
        });
    }

    private static String difficultyKey(Question question) {
        return question.difficulty() == null ? UNSPECIFIED : question.difficulty().name();
    }

    static String markBucket(int totalMarks) {
        int start = Math.floorDiv(totalMarks, 10) * 10;
        return start + "-" + (start + 10);
    }

    private String monthKey(Paper paper) {
        if (paper.getCreatedAt() == null) {
            return UNSPECIFIED;
        }
        return MONTH.format(paper.getCreatedAt().atZone(clock.getZone()));
    }

    private static <K extends Comparable<K>> Map<K, Long> sorted(Map<K, Long> counts) {
        return Collections.unmodifiableMap(new TreeMap<>(counts));
    }

    private static <K> Map<K, Long> sorted(Map<K, Long> counts, Comparator<K> order) {
        Map<K, Long> result = new TreeMap<>(order);
        result.putAll(counts);
        return Collections.unmodifiableMap(result);
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    private static Map<String, Integer> idealDifficulty() {
        Map<String, Integer> ideal = new LinkedHashMap<>();
        ideal.put("EASY", 30);
        ideal.put("MEDIUM", 40);
        ideal.put("HARD", 30);
        return Collections.unmodifiableMap(ideal);
    }
}
