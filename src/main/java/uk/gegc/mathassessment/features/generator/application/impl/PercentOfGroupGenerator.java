package uk.gegc.mathassessment.features.generator.application.impl;

import org.springframework.stereotype.Component;
import uk.gegc.mathassessment.features.curriculum.domain.model.TopicCategory;
import uk.gegc.mathassessment.features.generator.application.DeterministicItemGenerator;
import uk.gegc.mathassessment.features.item.application.OptionNormalizer;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;
import uk.gegc.mathassessment.shared.util.RandomSource;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Percentage of a group of students, rounded down to whole students.
 */
@Component
public class PercentOfGroupGenerator extends DeterministicItemGenerator {

    static final int MIN_TOTAL = 40;
    static final int MAX_TOTAL = 120;
    static final List<Integer> PERCENTAGES = List.of(25, 30, 40, 50, 60, 75, 80);
    static final List<String> CATEGORIES = List.of("wearing glasses", "playing sports", "taking music lessons");

    private static final List<Integer> DISTRACTOR_OFFSETS = List.of(-10, -5, 5, 10);

    public PercentOfGroupGenerator(RandomSource randomSource, OptionNormalizer optionNormalizer) {
        super(randomSource, optionNormalizer);
    }

    @Override
    public TopicCategory supportedCategory() {
        return TopicCategory.FRACTIONS_PERCENTS;
    }

    @Override
    public AssessmentItem generate(String difficulty) {
        int total = randomSource.nextInt(MIN_TOTAL, MAX_TOTAL);
        int percentage = randomSource.choice(PERCENTAGES);
        String category = randomSource.choice(CATEGORIES);
        return build(total, percentage, category, difficulty);
    }

    public AssessmentItem build(int total, int percentage, String category, String difficulty) {
        if (total <= 0 || percentage <= 0) {
            throw new IllegalArgumentException("Total and percentage must be positive");
        }
        int correct = total * percentage / 100;

        Set<String> distractors = new LinkedHashSet<>();
        for (int offset : DISTRACTOR_OFFSETS) {
            if (correct + offset > 0) {
                distractors.add(String.valueOf(correct + offset));
            }
        }
        String correctText = String.valueOf(correct);
        List<String> options = buildOptions(correctText, new ArrayList<>(distractors));

        return itemFor(difficulty)
                .question(String.format(
                        "In a group of %d students, %d%% are %s. How many students are %s?",
                        total, percentage, category, category))
                .options(options)
                .correctIndex(locate(options, correctText))
                .explanation(String.format(
                        "Compute %d%% of %d: $\\frac{%d}{100}\\times %d=%d$.",
                        percentage, total, percentage, total, correct))
                .build();
    }
}
