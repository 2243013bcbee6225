package uk.gegc.mathassessment.features.generator.application.impl;

import org.springframework.stereotype.Component;
import uk.gegc.mathassessment.features.curriculum.domain.model.TopicCategory;
import uk.gegc.mathassessment.features.generator.application.DeterministicItemGenerator;
import uk.gegc.mathassessment.features.item.application.OptionNormalizer;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;
import uk.gegc.mathassessment.shared.util.RandomSource;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Roots of a monic quadratic built from two distinct integer roots.
 */
@Component
public class QuadraticRootsGenerator extends DeterministicItemGenerator {

    static final int MIN_ROOT = -6;
    static final int MAX_ROOT = 6;

    private static final List<Integer> ROOT_RANGE = IntStream.rangeClosed(MIN_ROOT, MAX_ROOT)
            .boxed()
            .collect(Collectors.toUnmodifiableList());

    public QuadraticRootsGenerator(RandomSource randomSource, OptionNormalizer optionNormalizer) {
        super(randomSource, optionNormalizer);
    }

    @Override
    public TopicCategory supportedCategory() {
        return TopicCategory.QUADRATICS;
    }

    @Override
    public AssessmentItem generate(String difficulty) {
        List<Integer> roots = randomSource.sample(ROOT_RANGE, 2);
        return build(roots.get(0), roots.get(1), difficulty);
    }

    public AssessmentItem build(int firstRoot, int secondRoot, String difficulty) {
        if (firstRoot == secondRoot) {
            throw new IllegalArgumentException("Roots must be distinct");
        }
        int linear = -(firstRoot + secondRoot);
        int constant = firstRoot * secondRoot;

        String correct = rootsOption(firstRoot, secondRoot);
        List<String> options = buildOptions(correct, List.of(
                rootsOption(firstRoot + 1, secondRoot + 1),
                rootsOption(-firstRoot, -secondRoot),
                rootsOption(firstRoot, secondRoot + 2),
                rootsOption(firstRoot - 1, secondRoot)
        ));

        return itemFor(difficulty)
                .question(String.format("If $%s$, what are all possible values of $x$?",
                        monicEquation(linear, constant)))
                .options(options)
                .correctIndex(locate(options, correct))
                .explanation(String.format("Factor: $%s%s=0$ so $x=%d$ or $x=%d$.",
                        factor(firstRoot), factor(secondRoot), firstRoot, secondRoot))
                .build();
    }

    /**
     * Roots are listed in ascending order so the same root set always renders the same text.
     */
    static String rootsOption(int first, int second) {
        int low = Math.min(first, second);
        int high = Math.max(first, second);
        if (low == high) {
            return "$x=" + low + "$ only";
        }
        return "$x=" + low + "$ and $x=" + high + "$";
    }

    static String monicEquation(int linear, int constant) {
        StringBuilder sb = new StringBuilder("x^2");
        if (linear != 0) {
            sb.append(' ').append(linear < 0 ? '-' : '+').append(' ');
            if (Math.abs(linear) != 1) {
                sb.append(Math.abs(linear));
            }
            sb.append('x');
        }
        if (constant != 0) {
            sb.append(' ').append(signed(constant));
        }
        return sb.append(" = 0").toString();
    }

    private static String factor(int root) {
        if (root == 0) {
            return "x";
        }
        return "(x " + signed(-root) + ")";
    }
}
