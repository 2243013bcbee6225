package uk.gegc.mathassessment.features.generator.application.impl;

import org.springframework.stereotype.Component;
import uk.gegc.mathassessment.features.curriculum.domain.model.TopicCategory;
import uk.gegc.mathassessment.features.generator.application.DeterministicItemGenerator;
import uk.gegc.mathassessment.features.item.application.OptionNormalizer;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;
import uk.gegc.mathassessment.shared.util.RandomSource;

import java.util.List;

/**
 * Linear equation {@code ax + b = cx + d} whose intercept {@code b} is solved backwards
 * from the chosen root, so the root is always an exact integer.
 */
@Component
public class LinearEquationGenerator extends DeterministicItemGenerator {

    static final int MIN_ROOT = 2;
    static final int MAX_ROOT = 5;
    static final int MIN_LEFT_COEFFICIENT = 2;
    static final int MAX_LEFT_COEFFICIENT = 10;
    static final int MIN_RIGHT_CONSTANT = 5;
    static final int MAX_RIGHT_CONSTANT = 20;

    public LinearEquationGenerator(RandomSource randomSource, OptionNormalizer optionNormalizer) {
        super(randomSource, optionNormalizer);
    }

    @Override
    public TopicCategory supportedCategory() {
        return TopicCategory.INTERPRETING_VARIABLES;
    }

    @Override
    public AssessmentItem generate(String difficulty) {
        int left = randomSource.nextInt(MIN_LEFT_COEFFICIENT, MAX_LEFT_COEFFICIENT);
        int right = randomSource.nextInt(1, left - 1);
        int constant = randomSource.nextInt(MIN_RIGHT_CONSTANT, MAX_RIGHT_CONSTANT);
        int root = randomSource.nextInt(MIN_ROOT, MAX_ROOT);
        return build(left, right, constant, root, difficulty);
    }

    /**
     * @param left     coefficient of x on the left side
     * @param right    coefficient of x on the right side, smaller than {@code left}
     * @param constant constant on the right side
     * @param root     the value of x the equation is solved by
     */
    public AssessmentItem build(int left, int right, int constant, int root, String difficulty) {
        if (right < 1 || right >= left) {
            throw new IllegalArgumentException("Right coefficient must be in [1, left)");
        }
        int intercept = interceptFor(left, right, constant, root);

        String correct = String.valueOf(root);
        List<String> options = buildOptions(correct, List.of(
                String.valueOf(root + 1),
                String.valueOf(Math.max(1, root - 1)),
                String.valueOf(root + 2),
                String.valueOf(root * 2)
        ));

        return itemFor(difficulty)
                .question(String.format("If $%dx %s = %dx + %d$, what is the value of $x$?",
                        left, signed(intercept), right, constant))
                .options(options)
                .correctIndex(locate(options, correct))
                .explanation(String.format("$%dx-%dx=%d %s$ so $%dx=%d$, hence $x=%d$.",
                        left, right, constant, signed(-intercept), left - right, constant - intercept, root))
                .build();
    }

    static int interceptFor(int left, int right, int constant, int root) {
        return constant - root * (left - right);
    }
}
