package uk.gegc.mathassessment.features.ai.application;

import uk.gegc.mathassessment.features.ai.api.dto.GenerationOutcome;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;

/**
 * Coerces a text generator's untrusted reply into a valid item
 */
public interface ItemResponseValidator {

    /**
     * Repair the generated fields into an item, or fall back to the deterministic
     * generator for the topic when the reply is unusable.
     * <p>
     * A failed outcome, or a reply whose question or explanation is empty after
     * sanitizing, is never repaired: the deterministic item is returned instead.
     * Option count and answer index problems are repaired silently.
     * <p>
     * The declared answer is followed by its text, not its position: when duplicates or
     * blanks are dropped, the correct index moves with the declared option, even if the
     * raw index was beyond the fifth option. Only when that text does not survive repair
     * is the raw index kept if it lies in {@code [0, 5)}, and otherwise reset to 0.
     *
     * @param outcome    result of the text generator call
     * @param topic      topic the item was requested for
     * @param difficulty difficulty label, passed through verbatim
     * @return a valid item, never {@code null}
     */
    AssessmentItem validateOrFallback(GenerationOutcome outcome, String topic, String difficulty);
}
