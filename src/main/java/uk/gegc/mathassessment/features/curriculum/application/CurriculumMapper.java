package uk.gegc.mathassessment.features.curriculum.application;

import org.springframework.stereotype.Component;
import uk.gegc.mathassessment.features.curriculum.domain.model.CurriculumRule;
import uk.gegc.mathassessment.features.curriculum.domain.model.TopicCategory;
import uk.gegc.mathassessment.features.item.domain.model.CurriculumPlacement;

/**
 * Classifies a free-text topic into the curriculum taxonomy using case-insensitive
 * keyword matching. Pure: the same topic always maps to the same placement.
 */
@Component
public class CurriculumMapper {

    public TopicCategory classify(String topic) {
        for (CurriculumRule rule : CurriculumRule.values()) {
            if (rule.matches(topic)) {
                return rule.category();
            }
        }
        return CurriculumRule.DEFAULT.category();
    }

    public CurriculumPlacement map(String topic) {
        return classify(topic).placement();
    }
}
