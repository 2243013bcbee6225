package uk.gegc.mathassessment.features.ai.infra.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import uk.gegc.mathassessment.features.item.application.OptionNormalizer;

/**
 * Field names and example shape of the JSON object a text generator must reply with.
 */
public final class ItemResponseSchema {

    public static final String QUESTION = "question";
    public static final String OPTIONS = "options";
    public static final String CORRECT_INDEX = "correct_index";
    public static final String EXPLANATION = "explanation";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private ItemResponseSchema() {
    }

    /**
     * Compact JSON describing each key, embedded in prompts.
     */
    public static String describe() {
        ObjectNode schema = objectMapper.createObjectNode();
        schema.put(QUESTION, "string (use LaTeX if needed)");
        ArrayNode options = schema.putArray(OPTIONS);
        for (int i = 0; i < OptionNormalizer.OPTION_COUNT; i++) {
            options.add("string");
        }
        schema.put(CORRECT_INDEX, "integer (0-" + (OptionNormalizer.OPTION_COUNT - 1) + ")");
        schema.put(EXPLANATION, "string (step-by-step; LaTeX allowed)");
        return schema.toString();
    }
}
