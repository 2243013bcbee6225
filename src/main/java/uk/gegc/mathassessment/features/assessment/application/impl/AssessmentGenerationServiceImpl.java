package uk.gegc.mathassessment.features.assessment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.mathassessment.features.ai.api.dto.GenerationOutcome;
import uk.gegc.mathassessment.features.ai.api.dto.GenerationOutcome.FailureReason;
import uk.gegc.mathassessment.features.ai.application.ItemResponseValidator;
import uk.gegc.mathassessment.features.ai.application.PromptTemplateService;
import uk.gegc.mathassessment.features.ai.application.TextGenerator;
import uk.gegc.mathassessment.features.assessment.application.AssessmentGenerationService;
import uk.gegc.mathassessment.features.assessment.domain.model.TopicPool;
import uk.gegc.mathassessment.features.assessment.domain.model.TopicSlot;
import uk.gegc.mathassessment.features.generator.application.DeterministicGeneratorFactory;
import uk.gegc.mathassessment.features.item.application.AssessmentItemValidator;
import uk.gegc.mathassessment.features.item.application.OptionNormalizer;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;
import uk.gegc.mathassessment.shared.util.RandomSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class AssessmentGenerationServiceImpl implements AssessmentGenerationService {

    private final Optional<TextGenerator> textGenerator;
    private final PromptTemplateService promptTemplateService;
    private final ItemResponseValidator itemResponseValidator;
    private final DeterministicGeneratorFactory deterministicGeneratorFactory;
    private final OptionNormalizer optionNormalizer;
    private final AssessmentItemValidator assessmentItemValidator;
    private final RandomSource randomSource;

    @Override
    public List<AssessmentItem> generateAssessment(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Item count cannot be negative");
        }
        log.info("Generating assessment with {} item(s) using {}", count,
                textGenerator.map(TextGenerator::name).orElse("deterministic generators only"));

        List<AssessmentItem> items = new ArrayList<>(count);
        for (TopicSlot slot : sampleTopics(count)) {
            items.add(generateItem(slot.topic(), slot.difficulty()));
        }

        List<AssessmentItem> checked = items.stream()
                .map(this::enforceInvariants)
                .toList();
        log.info("Assessment generated: {} item(s)", checked.size());
        return checked;
    }

    @Override
    public AssessmentItem generateItem(String topic, String difficulty) {
        if (textGenerator.isEmpty()) {
            return deterministicGeneratorFactory.generate(topic, difficulty);
        }

        String prompt = promptTemplateService.buildItemPrompt(topic, difficulty);
        GenerationOutcome outcome;
        try {
            outcome = textGenerator.get().generate(prompt);
        } catch (RuntimeException e) {
            log.warn("Text generator {} threw for topic '{}': {}", textGenerator.get().name(), topic, e.getMessage());
            outcome = GenerationOutcome.failure(FailureReason.BACKEND_FAILURE, e.getMessage());
        }
        return itemResponseValidator.validateOrFallback(outcome, topic, difficulty);
    }

    @Override
    public List<TopicSlot> sampleTopics(int count) {
        List<TopicSlot> pool = TopicPool.DEFAULT;
        List<TopicSlot> picks = new ArrayList<>(randomSource.sample(pool, Math.min(count, pool.size())));
        while (picks.size() < count) {
            picks.add(randomSource.choice(pool));
        }
        return picks;
    }

    /**
     * Last-resort guard on option count and answer index. Upstream contracts already
     * guarantee both, so a correction here is logged as a warning.
     */
    AssessmentItem enforceInvariants(AssessmentItem item) {
        AssessmentItem.AssessmentItemBuilder repaired = null;
        if (item.options().size() != OptionNormalizer.OPTION_COUNT) {
            log.warn("Item '{}' has {} options, repairing", item.question(), item.options().size());
            repaired = item.toBuilder().options(optionNormalizer.ensureFive(item.options()));
        }
        if (item.correctIndex() < 0 || item.correctIndex() >= OptionNormalizer.OPTION_COUNT) {
            log.warn("Item '{}' has correct index {}, resetting to 0", item.question(), item.correctIndex());
            repaired = (repaired != null ? repaired : item.toBuilder()).correctIndex(0);
        }
        AssessmentItem result = repaired != null ? repaired.build() : item;

        List<String> violations = assessmentItemValidator.findViolations(result);
        if (!violations.isEmpty()) {
            log.warn("Item '{}' still violates: {}", result.question(), violations);
        }
        return result;
    }
}
