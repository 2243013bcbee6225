package uk.gegc.mathassessment.features.curriculum.domain.model;

import java.util.List;
import java.util.Locale;

/**
 * Keyword rules in priority order; the first rule whose keyword occurs in a topic wins.
 * {@link #DEFAULT} has no keywords and matches everything.
 */
public enum CurriculumRule {

    CIRCLE(TopicCategory.CIRCLES, "circle"),
    QUADRATIC(TopicCategory.QUADRATICS, "quadratic"),
    COORDINATE(TopicCategory.COORDINATE_GEOMETRY, "coordinate"),
    FRACTION_OR_PERCENT(TopicCategory.FRACTIONS_PERCENTS, "fraction", "percent"),
    VARIABLES_OR_LINEAR(TopicCategory.INTERPRETING_VARIABLES, "interpreting variables", "linear"),
    DEFAULT(TopicCategory.PROBLEM_SOLVING);

    private final TopicCategory category;
    private final List<String> keywords;

    CurriculumRule(TopicCategory category, String... keywords) {
        this.category = category;
        this.keywords = List.of(keywords);
    }

    public TopicCategory category() {
        return category;
    }

    public boolean matches(String topic) {
        if (keywords.isEmpty()) {
            return true;
        }
        String normalized = topic == null ? "" : topic.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(normalized::contains);
    }
}
