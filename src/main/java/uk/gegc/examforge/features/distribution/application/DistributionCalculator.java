package uk.gegc.examforge.features.distribution.application;

import org.springframework.stereotype.Component;
import uk.gegc.examforge.features.distribution.domain.model.DistributionSummary;
import uk.gegc.examforge.features.distribution.domain.model.DistributionTargets;
import uk.gegc.examforge.features.paper.domain.model.CognitiveLevel;
import uk.gegc.examforge.features.paper.domain.model.GenerationRequest;
import uk.gegc.examforge.features.paper.domain.model.Provenance;
import uk.gegc.examforge.features.paper.domain.model.ProvenanceRatio;
import uk.gegc.examforge.features.paper.domain.model.Question;
import uk.gegc.examforge.features.paper.domain.model.QuestionCategory;
import uk.gegc.examforge.features.paper.domain.model.QuestionSpec;
import uk.gegc.examforge.shared.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Single source of truth for distribution math. The request validation path and the analytics
 * path both go through here so a count is always computed the same way.
 *
 * <p>Stateless; safe to call from any thread.
 */
@Component
public class DistributionCalculator {

    /**
     * Validates a generation request and returns its target totals.
     *
     * @throws ValidationException when the provenance ratio does not sum to 100, a percentage is out
     *                             of range, a category is repeated or negative, or nothing is requested
     */
    public DistributionTargets computeTargets(GenerationRequest request) {
        if (request == null) {
            throw new ValidationException("Generation request is required");
        }
        validateProvenance(request.provenance());

        List<QuestionSpec> categories = request.categories();
        if (categories.isEmpty()) {
            throw new ValidationException("At least one question category is required");
        }
        if (categories.size() > QuestionCategory.values().length) {
            throw new ValidationException("At most " + QuestionCategory.values().length + " question categories are allowed");
        }

        Set<QuestionCategory> seen = EnumSet.noneOf(QuestionCategory.class);
        int totalQuestions = 0;
        int totalMarks = 0;
        for (QuestionSpec spec : categories) {
            if (spec == null || spec.category() == null) {
                throw new ValidationException("Question category is required");
            }
            if (!seen.add(spec.category())) {
                throw new ValidationException("Question category " + spec.category() + " is specified more than once");
            }
            if (spec.count() < 0) {
                throw new ValidationException("Question count for " + spec.category() + " must not be negative");
            }
            if (spec.marksEach() < 0) {
                throw new ValidationException("Marks per question for " + spec.category() + " must not be negative");
            }
            try {
                totalQuestions = Math.addExact(totalQuestions, spec.count());
                totalMarks = Math.addExact(totalMarks, spec.categoryMarks());
            } catch (ArithmeticException e) {
                throw new ValidationException("Requested questions or marks are too large", e);
            }
        }

        if (totalQuestions == 0) {
            throw new ValidationException("At least one question must be requested");
        }
        if (totalMarks <= 0) {
            throw new ValidationException("Total marks must be positive");
        }
        return new DistributionTargets(totalMarks, totalQuestions);
    }

    public void validateProvenance(ProvenanceRatio ratio) {
        if (ratio == null) {
            throw new ValidationException("Provenance ratio is required");
        }
        for (Provenance provenance : Provenance.values()) {
            int percent = ratio.percentFor(provenance);
            if (percent < 0 || percent > 100) {
                throw new ValidationException(provenance + " percentage must be between 0 and 100, got " + percent);
            }
        }
        if (ratio.sum() != 100) {
            throw new ValidationException("Provenance percentages must sum to 100, got " + ratio.sum());
        }
    }

    /**
     * Groups questions by category, cognitive level, provenance and (level, provenance). Each
     * question is counted exactly once per dimension.
     */
    public DistributionSummary computeRealized(List<Question> questions) {
        if (questions == null || questions.isEmpty()) {
            return DistributionSummary.EMPTY;
        }

        Map<QuestionCategory, Integer> byCategory = new EnumMap<>(QuestionCategory.class);
        Map<QuestionCategory, Integer> marksByCategory = new EnumMap<>(QuestionCategory.class);
        Map<CognitiveLevel, Integer> byLevel = new EnumMap<>(CognitiveLevel.class);
        Map<Provenance, Integer> byProvenance = new EnumMap<>(Provenance.class);
        Map<CognitiveLevel, Map<Provenance, Integer>> pairs = new EnumMap<>(CognitiveLevel.class);
        int totalMarks = 0;

        for (Question question : questions) {
            QuestionCategory category = requireDimension(question.category(), "category");
            CognitiveLevel level = requireDimension(question.cognitiveLevel(), "cognitive level");
            Provenance provenance = requireDimension(question.provenance(), "provenance");

            byCategory.merge(category, 1, Integer::sum);
            marksByCategory.merge(category, question.marks(), Integer::sum);
            byLevel.merge(level, 1, Integer::sum);
            byProvenance.merge(provenance, 1, Integer::sum);
            pairs.computeIfAbsent(level, l -> new EnumMap<>(Provenance.class))
                    .merge(provenance, 1, Integer::sum);
            totalMarks += question.marks();
        }

        return new DistributionSummary(questions.size(), totalMarks, byCategory, marksByCategory,
                byLevel, byProvenance, pairs);
    }

    /**
     * Counts items by key, preserving first-seen key order. Used by the aggregation path so that
     * paper sets are grouped with the same rule as single papers.
     */
    public <T, K> Map<K, Long> countBy(Collection<T> items, Function<T, K> classifier) {
        Map<K, Long> counts = new LinkedHashMap<>();
        if (items == null) {
            return counts;
        }
        for (T item : items) {
            counts.merge(classifier.apply(item), 1L, Long::sum);
        }
        return counts;
    }

    /**
     * Converts counts to percentages of {@code total}, rounded half-up to one decimal. A zero total
     * yields 0 for every key.
     */
    public <K> Map<K, Double> percentages(Map<K, ? extends Number> counts, long total) {
        Map<K, Double> result = new LinkedHashMap<>();
        counts.forEach((key, count) -> result.put(key, percentage(count.longValue(), total)));
        return result;
    }

    public double percentage(long count, long total) {
        if (total == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(count * 100.0 / total)
                .setScale(1, RoundingMode.HALF_UP)
                .doubleValue();
    }

    /**
     * Target number of questions per provenance. Previous and creative get the floor of their
     * share; new absorbs the remainder so the counts always add up to {@code totalQuestions}.
     */
    public Map<Provenance, Integer> allocateProvenance(int totalQuestions, ProvenanceRatio ratio) {
        validateProvenance(ratio);
        int previous = totalQuestions * ratio.previousPercent() / 100;
        int creative = totalQuestions * ratio.creativePercent() / 100;
        Map<Provenance, Integer> allocation = new EnumMap<>(Provenance.class);
        allocation.put(Provenance.PREVIOUS, previous);
        allocation.put(Provenance.CREATIVE, creative);
        allocation.put(Provenance.NEW, totalQuestions - previous - creative);
        return allocation;
    }

    /**
     * Provenance for each position of a question list laid out according to the allocation:
     * previous first, then creative, then new.
     */
    public List<Provenance> provenanceSequence(int totalQuestions, ProvenanceRatio ratio) {
        Map<Provenance, Integer> allocation = allocateProvenance(totalQuestions, ratio);
        List<Provenance> sequence = new ArrayList<>(totalQuestions);
        for (Provenance provenance : Provenance.values()) {
            for (int i = 0; i < allocation.get(provenance); i++) {
                sequence.add(provenance);
            }
        }
        return sequence;
    }

    private static <T> T requireDimension(T value, String dimension) {
        if (value == null) {
            throw new ValidationException("Question is missing its " + dimension);
        }
        return value;
    }
}
