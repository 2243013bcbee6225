package uk.gegc.mathassessment.features.item.application;

import org.springframework.stereotype.Component;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks the invariants every item leaving the generation pipeline must satisfy.
 */
@Component
public class AssessmentItemValidator {

    public List<String> findViolations(AssessmentItem item) {
        List<String> violations = new ArrayList<>();
        if (item == null) {
            violations.add("Item cannot be null");
            return violations;
        }

        if (isBlank(item.question())) {
            violations.add("Question text must not be empty");
        }
        if (isBlank(item.explanation())) {
            violations.add("Explanation must not be empty");
        }

        List<String> options = item.options();
        if (options.size() != OptionNormalizer.OPTION_COUNT) {
            violations.add("Item must have exactly " + OptionNormalizer.OPTION_COUNT
                    + " options, found " + options.size());
        }
        Set<String> seen = new HashSet<>();
        for (String option : options) {
            if (isBlank(option)) {
                violations.add("Each option needs non-empty text");
            } else if (!seen.add(option)) {
                violations.add("Options must be unique, found duplicate: " + option);
            }
        }

        if (item.correctIndex() < 0 || item.correctIndex() >= OptionNormalizer.OPTION_COUNT) {
            violations.add("Correct index " + item.correctIndex() + " is out of range");
        }

        if (item.hasPoints() && !item.hasImage()) {
            violations.add("Points data requires the image flag");
        }
        return violations;
    }

    public boolean isValid(AssessmentItem item) {
        return findViolations(item).isEmpty();
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
