package uk.gegc.mathassessment.features.assessment.application;

import uk.gegc.mathassessment.features.assessment.domain.model.TopicSlot;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;

import java.util.List;

/**
 * Entry point of the generation pipeline
 */
public interface AssessmentGenerationService {

    /**
     * Generate an ordered assessment. Never fails because of generation quality:
     * unusable backend output is replaced by deterministic items.
     *
     * @param count number of items, not negative
     * @return exactly {@code count} valid items in sampled topic order
     */
    List<AssessmentItem> generateAssessment(int count);

    /**
     * Generate a single item through the configured text generator, or directly with
     * the deterministic generator when no text generator is configured.
     */
    AssessmentItem generateItem(String topic, String difficulty);

    /**
     * Sample topic slots: distinct slots while the pool lasts, then independent draws
     * that may repeat.
     */
    List<TopicSlot> sampleTopics(int count);
}
