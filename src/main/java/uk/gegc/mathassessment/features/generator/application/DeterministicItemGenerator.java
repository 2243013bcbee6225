package uk.gegc.mathassessment.features.generator.application;

import uk.gegc.mathassessment.features.curriculum.domain.model.TopicCategory;
import uk.gegc.mathassessment.features.item.application.OptionNormalizer;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;
import uk.gegc.mathassessment.shared.util.RandomSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds an item whose answer is correct by arithmetic construction, without any
 * external text generator.
 */
public abstract class DeterministicItemGenerator {

    protected final RandomSource randomSource;
    protected final OptionNormalizer optionNormalizer;

    protected DeterministicItemGenerator(RandomSource randomSource, OptionNormalizer optionNormalizer) {
        this.randomSource = randomSource;
        this.optionNormalizer = optionNormalizer;
    }

    /**
     * Returns the curriculum category this generator produces items for
     * @return the supported category
     */
    public abstract TopicCategory supportedCategory();

    public abstract AssessmentItem generate(String difficulty);

    /**
     * Normalizes the correct value plus distractors to five options and shuffles them.
     * The correct value comes first so normalization always keeps it.
     */
    protected List<String> buildOptions(String correct, List<String> distractors) {
        List<String> candidates = new ArrayList<>(distractors.size() + 1);
        candidates.add(correct);
        candidates.addAll(distractors);
        List<String> options = optionNormalizer.ensureFive(candidates);
        randomSource.shuffle(options);
        return options;
    }

    /**
     * Finds the correct option by exact text match after normalization and shuffling.
     */
    protected int locate(List<String> options, String correct) {
        int index = options.indexOf(correct);
        if (index < 0) {
            throw new IllegalStateException("Correct option '" + correct + "' lost during option repair");
        }
        return index;
    }

    protected AssessmentItem.AssessmentItemBuilder itemFor(String difficulty) {
        return AssessmentItem.placedIn(supportedCategory().placement())
                .difficulty(difficulty)
                .hasImage(false);
    }

    protected static String signed(int value) {
        return value < 0 ? "- " + Math.abs(value) : "+ " + value;
    }
}
