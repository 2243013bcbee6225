package uk.gegc.mathassessment.features.item.domain.model;

/**
 * Canonical (subject, unit, topic) position of an item in the curriculum taxonomy.
 */
public record CurriculumPlacement(String subject, String unit, String topic) {

    public CurriculumPlacement {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        if (unit == null || unit.isBlank()) {
            throw new IllegalArgumentException("Unit cannot be null or blank");
        }
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Topic cannot be null or blank");
        }
    }
}
