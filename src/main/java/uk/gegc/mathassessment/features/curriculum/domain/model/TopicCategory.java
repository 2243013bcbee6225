package uk.gegc.mathassessment.features.curriculum.domain.model;

import uk.gegc.mathassessment.features.item.domain.model.CurriculumPlacement;

/**
 * Canonical curriculum categories an assessment topic can fall into.
 */
public enum TopicCategory {

    CIRCLES("Geometry and Measurement", "Circles (Area, circumference)"),
    QUADRATICS("Algebra", "Quadratic Equations & Functions (Finding roots/solutions, graphing)"),
    COORDINATE_GEOMETRY("Geometry and Measurement", "Coordinate Geometry"),
    FRACTIONS_PERCENTS("Numbers and Operations", "Fractions, Decimals, & Percents"),
    INTERPRETING_VARIABLES("Algebra", "Interpreting Variables"),
    PROBLEM_SOLVING("Problem Solving", "Algebra");

    public static final String SUBJECT = "Quantitative Math";

    private final String unit;
    private final String topic;

    TopicCategory(String unit, String topic) {
        this.unit = unit;
        this.topic = topic;
    }

    public CurriculumPlacement placement() {
        return new CurriculumPlacement(SUBJECT, unit, topic);
    }

    /**
     * Only coordinate geometry items are illustrated with a coordinate plane.
     */
    public boolean requiresImage() {
        return this == COORDINATE_GEOMETRY;
    }
}
