package uk.gegc.mathassessment.features.ai.application;

import uk.gegc.mathassessment.features.ai.api.dto.GenerationOutcome;

/**
 * External free-form text generator producing a candidate item.
 * <p>
 * Implementations block until the backend answers and report every problem through
 * a failed {@link GenerationOutcome} rather than an exception. Callers still treat an
 * unexpected exception as a failed outcome.
 */
public interface TextGenerator {

    /**
     * Send a prompt to the backend and extract the JSON object from its reply
     *
     * @param prompt the rendered instruction
     * @return parsed fields, or the failure reason
     */
    GenerationOutcome generate(String prompt);

    /**
     * Short name used in logs
     */
    String name();
}
