package uk.gegc.mathassessment.features.assessment.domain.model;

/**
 * A topic together with the difficulty an item on it is requested at.
 */
public record TopicSlot(String topic, String difficulty) {

    public TopicSlot {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Topic cannot be null or blank");
        }
        if (difficulty == null || difficulty.isBlank()) {
            throw new IllegalArgumentException("Difficulty cannot be null or blank");
        }
    }
}
