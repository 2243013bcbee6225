package uk.gegc.mathassessment.features.item.domain.model;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One multiple-choice assessment item. Built once per generation call and never
 * modified afterwards; exporters only read it.
 *
 * @param question     sanitized stem, may contain LaTeX
 * @param options      answer options in display order
 * @param correctIndex position of the correct option in {@code options}
 * @param explanation  sanitized worked solution
 * @param difficulty   free-form label, passed through unchanged
 * @param hasImage     whether the item asks for a coordinate-plane illustration
 * @param pointsData   label to point mapping for the illustration, {@code null} when there is none
 */
@Builder(toBuilder = true)
public record AssessmentItem(
        String question,
        List<String> options,
        int correctIndex,
        String explanation,
        String subject,
        String unit,
        String topic,
        String difficulty,
        boolean hasImage,
        Map<String, GridPoint> pointsData
) {
    public AssessmentItem {
        if (options == null) {
            throw new IllegalArgumentException("Options cannot be null");
        }
        options = List.copyOf(options);
        if (pointsData != null) {
            pointsData = Collections.unmodifiableMap(new LinkedHashMap<>(pointsData));
        }
    }

    public boolean hasPoints() {
        return pointsData != null && !pointsData.isEmpty();
    }

    public String correctOption() {
        return correctIndex >= 0 && correctIndex < options.size() ? options.get(correctIndex) : null;
    }

    public CurriculumPlacement placement() {
        return new CurriculumPlacement(subject, unit, topic);
    }

    public static AssessmentItemBuilder placedIn(CurriculumPlacement placement) {
        return builder()
                .subject(placement.subject())
                .unit(placement.unit())
                .topic(placement.topic());
    }
}
