package uk.gegc.mathassessment.features.assessment.domain.model;

import java.util.List;

/**
 * The fixed set of topics an assessment samples from.
 */
public final class TopicPool {

    public static final List<TopicSlot> DEFAULT = List.of(
            new TopicSlot("Circles (Area, circumference)", "moderate"),
            new TopicSlot("Quadratic Equations & Functions (Finding roots/solutions, graphing)", "moderate"),
            new TopicSlot("Coordinate Geometry", "easy"),
            new TopicSlot("Fractions, Decimals, & Percents", "moderate"),
            new TopicSlot("Interpreting Variables", "easy")
    );

    private TopicPool() {
    }
}
