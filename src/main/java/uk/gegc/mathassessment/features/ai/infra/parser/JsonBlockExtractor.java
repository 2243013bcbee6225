package uk.gegc.mathassessment.features.ai.infra.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.mathassessment.features.ai.api.dto.GenerationOutcome;
import uk.gegc.mathassessment.features.ai.api.dto.GenerationOutcome.FailureReason;
import uk.gegc.mathassessment.shared.exception.AIResponseParseException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Locates the JSON object in free-form generator output by taking everything from the
 * first opening brace to the last closing brace, and parses it as an untyped map.
 */
@Component
@Slf4j
public class JsonBlockExtractor {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> FIELD_BAG = new TypeReference<>() {
    };

    public Map<String, Object> extract(String rawText) throws AIResponseParseException {
        if (rawText == null) {
            throw new AIResponseParseException("No JSON object found in model output");
        }
        int start = rawText.indexOf('{');
        int end = rawText.lastIndexOf('}');
        if (start == -1 || end <= start) {
            throw new AIResponseParseException("No JSON object found in model output");
        }

        String payload = rawText.substring(start, end + 1);
        try {
            return objectMapper.readValue(payload, FIELD_BAG);
        } catch (JsonProcessingException e) {
            throw new AIResponseParseException("JSON parse failed: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Same as {@link #extract(String)} but reports a parse failure as a failed outcome.
     */
    public GenerationOutcome toOutcome(String rawText) {
        try {
            return GenerationOutcome.success(extract(rawText));
        } catch (AIResponseParseException e) {
            log.debug("Discarding unparseable model output: {}", e.getMessage());
            return GenerationOutcome.failure(FailureReason.MALFORMED_RESPONSE, e.getMessage());
        }
    }
}
