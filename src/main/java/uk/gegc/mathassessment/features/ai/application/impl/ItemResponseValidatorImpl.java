package uk.gegc.mathassessment.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.mathassessment.features.ai.api.dto.GenerationOutcome;
import uk.gegc.mathassessment.features.ai.application.ItemResponseValidator;
import uk.gegc.mathassessment.features.curriculum.application.CurriculumMapper;
import uk.gegc.mathassessment.features.curriculum.domain.model.TopicCategory;
import uk.gegc.mathassessment.features.generator.application.DeterministicGeneratorFactory;
import uk.gegc.mathassessment.features.item.application.OptionNormalizer;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;
import uk.gegc.mathassessment.shared.util.TextSanitizer;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static uk.gegc.mathassessment.features.ai.infra.schema.ItemResponseSchema.CORRECT_INDEX;
import static uk.gegc.mathassessment.features.ai.infra.schema.ItemResponseSchema.EXPLANATION;
import static uk.gegc.mathassessment.features.ai.infra.schema.ItemResponseSchema.OPTIONS;
import static uk.gegc.mathassessment.features.ai.infra.schema.ItemResponseSchema.QUESTION;

/**
 * Implementation of ItemResponseValidator. Never trusts the types the backend declares:
 * every field is coerced and checked.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ItemResponseValidatorImpl implements ItemResponseValidator {

    static final int INVALID_INDEX = -1;

    private final TextSanitizer textSanitizer;
    private final OptionNormalizer optionNormalizer;
    private final CurriculumMapper curriculumMapper;
    private final DeterministicGeneratorFactory deterministicGeneratorFactory;

    @Override
    public AssessmentItem validateOrFallback(GenerationOutcome outcome, String topic, String difficulty) {
        if (outcome == null || !outcome.ok()) {
            log.warn("Falling back to deterministic item for '{}': {} ({})", topic,
                    outcome == null ? "no outcome" : outcome.error(),
                    outcome == null ? "none" : outcome.reason());
            return deterministicGeneratorFactory.generate(topic, difficulty);
        }

        Map<String, Object> data = outcome.data();
        String question = textSanitizer.sanitize(data.get(QUESTION));
        String explanation = textSanitizer.sanitize(data.get(EXPLANATION));
        if (question.isEmpty() || explanation.isEmpty()) {
            log.warn("Falling back to deterministic item for '{}': generated {} empty after sanitizing",
                    topic, question.isEmpty() ? QUESTION : EXPLANATION);
            return deterministicGeneratorFactory.generate(topic, difficulty);
        }

        List<Object> candidates = asCandidates(data.get(OPTIONS));
        List<String> options = optionNormalizer.ensureFive(candidates);
        int correctIndex = resolveCorrectIndex(candidates, coerceIndex(data.get(CORRECT_INDEX)), options);

        TopicCategory category = curriculumMapper.classify(topic);
        return AssessmentItem.placedIn(category.placement())
                .question(question)
                .options(options)
                .correctIndex(correctIndex)
                .explanation(explanation)
                .difficulty(difficulty)
                .hasImage(category.requiresImage())
                .build();
    }

    /**
     * Follows the declared answer's text through option repair. When that text did not
     * survive, the declared index is kept if it is in range, otherwise the first option wins.
     */
    int resolveCorrectIndex(List<Object> candidates, int declaredIndex, List<String> repairedOptions) {
        if (declaredIndex >= 0 && declaredIndex < candidates.size()) {
            String declaredText = textSanitizer.sanitize(candidates.get(declaredIndex));
            int relocated = declaredText.isEmpty() ? -1 : repairedOptions.indexOf(declaredText);
            if (relocated >= 0) {
                return relocated;
            }
        }
        if (declaredIndex >= 0 && declaredIndex < OptionNormalizer.OPTION_COUNT) {
            return declaredIndex;
        }
        log.debug("Correct index {} out of range, defaulting to 0", declaredIndex);
        return 0;
    }

    /**
     * Integer coercion of the declared answer index. Fractional numbers are truncated,
     * numeric strings are parsed, everything else yields {@link #INVALID_INDEX}.
     */
    int coerceIndex(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return narrow(((Number) value).longValue());
        }
        if (value instanceof BigInteger bigInteger) {
            return bigInteger.bitLength() < Long.SIZE ? narrow(bigInteger.longValue()) : INVALID_INDEX;
        }
        if (value instanceof BigDecimal || value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            return Double.isFinite(number) ? narrow((long) number) : INVALID_INDEX;
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                log.debug("Correct index '{}' is not an integer", text);
                return INVALID_INDEX;
            }
        }
        return INVALID_INDEX;
    }

    private List<Object> asCandidates(Object value) {
        if (value == null || value instanceof Map<?, ?>) {
            return new ArrayList<>();
        }
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        List<Object> single = new ArrayList<>();
        single.add(value);
        return single;
    }

    private int narrow(long value) {
        return value < Integer.MIN_VALUE || value > Integer.MAX_VALUE ? INVALID_INDEX : (int) value;
    }
}
