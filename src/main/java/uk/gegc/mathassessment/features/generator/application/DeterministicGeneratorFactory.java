package uk.gegc.mathassessment.features.generator.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.mathassessment.features.curriculum.application.CurriculumMapper;
import uk.gegc.mathassessment.features.curriculum.domain.model.TopicCategory;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a free-text topic to the deterministic generator of its curriculum category.
 * Topics outside every known category get a linear equation item.
 */
@Component
@Slf4j
public class DeterministicGeneratorFactory {

    private static final TopicCategory DEFAULT_CATEGORY = TopicCategory.INTERPRETING_VARIABLES;

    private final Map<TopicCategory, DeterministicItemGenerator> generatorMap = new EnumMap<>(TopicCategory.class);
    private final CurriculumMapper curriculumMapper;

    public DeterministicGeneratorFactory(List<DeterministicItemGenerator> generators, CurriculumMapper curriculumMapper) {
        this.curriculumMapper = curriculumMapper;
        generators.forEach(generator -> generatorMap.put(generator.supportedCategory(), generator));
        if (!generatorMap.containsKey(DEFAULT_CATEGORY)) {
            throw new IllegalStateException("No deterministic generator registered for " + DEFAULT_CATEGORY);
        }
        log.debug("Deterministic generators registered for categories: {}", generatorMap.keySet());
    }

    public DeterministicItemGenerator getGenerator(TopicCategory category) {
        DeterministicItemGenerator generator = generatorMap.get(category);
        return generator != null ? generator : generatorMap.get(DEFAULT_CATEGORY);
    }

    public AssessmentItem generate(String topic, String difficulty) {
        TopicCategory category = curriculumMapper.classify(topic);
        log.debug("Generating deterministic item for topic '{}' (category={})", topic, category);
        return getGenerator(category).generate(difficulty);
    }
}
