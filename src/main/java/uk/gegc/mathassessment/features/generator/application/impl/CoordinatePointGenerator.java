package uk.gegc.mathassessment.features.generator.application.impl;

import org.springframework.stereotype.Component;
import uk.gegc.mathassessment.features.curriculum.domain.model.TopicCategory;
import uk.gegc.mathassessment.features.generator.application.DeterministicItemGenerator;
import uk.gegc.mathassessment.features.item.application.OptionNormalizer;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;
import uk.gegc.mathassessment.features.item.domain.model.GridPoint;
import uk.gegc.mathassessment.shared.util.RandomSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Asks which of five labelled points has a given x-coordinate. Every point has a
 * different x-coordinate, so exactly one label is correct. The label to point mapping
 * is exposed for plotting.
 */
@Component
public class CoordinatePointGenerator extends DeterministicItemGenerator {

    static final int MIN_COORDINATE = -5;
    static final int MAX_COORDINATE = 5;
    static final List<String> LABELS = List.of("A", "B", "C", "D", "E");

    public CoordinatePointGenerator(RandomSource randomSource, OptionNormalizer optionNormalizer) {
        super(randomSource, optionNormalizer);
    }

    @Override
    public TopicCategory supportedCategory() {
        return TopicCategory.COORDINATE_GEOMETRY;
    }

    @Override
    public AssessmentItem generate(String difficulty) {
        GridPoint target = randomPoint();
        List<GridPoint> points = new ArrayList<>(LABELS.size());
        points.add(target);
        Set<Integer> usedX = new HashSet<>();
        usedX.add(target.x());
        while (points.size() < LABELS.size()) {
            int x = randomSource.nextInt(MIN_COORDINATE, MAX_COORDINATE);
            if (!usedX.add(x)) {
                continue;
            }
            points.add(new GridPoint(x, randomSource.nextInt(MIN_COORDINATE, MAX_COORDINATE)));
        }
        randomSource.shuffle(points);
        return build(points, target, difficulty);
    }

    /**
     * @param points labelled in order A to E
     * @param target the point whose x-coordinate the question asks about
     */
    public AssessmentItem build(List<GridPoint> points, GridPoint target, String difficulty) {
        if (points.size() != LABELS.size()) {
            throw new IllegalArgumentException("Exactly " + LABELS.size() + " points are required");
        }
        long matchingX = points.stream().filter(p -> p.x() == target.x()).count();
        if (matchingX != 1 || !points.contains(target)) {
            throw new IllegalArgumentException("Target must be the only point with x = " + target.x());
        }

        Map<String, GridPoint> pointsData = new LinkedHashMap<>();
        for (int i = 0; i < LABELS.size(); i++) {
            pointsData.put(LABELS.get(i), points.get(i));
        }
        List<String> options = optionNormalizer.ensureFive(LABELS);
        String answerLabel = LABELS.get(points.indexOf(target));

        return itemFor(difficulty)
                .question(String.format(
                        "Which point on the coordinate plane has an $x$-coordinate of %d?", target.x()))
                .options(options)
                .correctIndex(locate(options, answerLabel))
                .explanation(String.format("Point %s is at $(%d, %d)$ so its $x$-coordinate is %d.",
                        answerLabel, target.x(), target.y(), target.x()))
                .hasImage(true)
                .pointsData(pointsData)
                .build();
    }

    private GridPoint randomPoint() {
        return new GridPoint(
                randomSource.nextInt(MIN_COORDINATE, MAX_COORDINATE),
                randomSource.nextInt(MIN_COORDINATE, MAX_COORDINATE));
    }
}
