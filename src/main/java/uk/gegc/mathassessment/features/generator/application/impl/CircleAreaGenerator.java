package uk.gegc.mathassessment.features.generator.application.impl;

import org.springframework.stereotype.Component;
import uk.gegc.mathassessment.features.curriculum.domain.model.TopicCategory;
import uk.gegc.mathassessment.features.generator.application.DeterministicItemGenerator;
import uk.gegc.mathassessment.features.item.application.OptionNormalizer;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;
import uk.gegc.mathassessment.shared.util.RandomSource;

import java.util.List;

/**
 * Area of a circle from its radius. Options are coefficients of pi.
 */
@Component
public class CircleAreaGenerator extends DeterministicItemGenerator {

    static final int MIN_RADIUS = 3;
    static final int MAX_RADIUS = 12;

    public CircleAreaGenerator(RandomSource randomSource, OptionNormalizer optionNormalizer) {
        super(randomSource, optionNormalizer);
    }

    @Override
    public TopicCategory supportedCategory() {
        return TopicCategory.CIRCLES;
    }

    @Override
    public AssessmentItem generate(String difficulty) {
        return build(randomSource.nextInt(MIN_RADIUS, MAX_RADIUS), difficulty);
    }

    public AssessmentItem build(int radius, String difficulty) {
        if (radius <= 0) {
            throw new IllegalArgumentException("Radius must be positive");
        }
        int area = radius * radius;
        String correct = piMultiple(area);
        List<String> options = buildOptions(correct, List.of(
                piMultiple(2 * radius),
                piMultiple(radius),
                piMultiple(2 * area),
                piMultiple(Math.max(1, area / 2))
        ));

        return itemFor(difficulty)
                .question(String.format(
                        "A circle has a radius of %d units. What is the area of the circle?", radius))
                .options(options)
                .correctIndex(locate(options, correct))
                .explanation(String.format(
                        "Area formula: $A=\\pi r^2$. With $r=%d$, $A=\\pi\\cdot %d^2=%d\\pi$ square units.",
                        radius, radius, area))
                .build();
    }

    static String piMultiple(int coefficient) {
        return "$" + coefficient + "\\pi$";
    }
}
