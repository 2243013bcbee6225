package uk.gegc.mathassessment.features.ai.application;

/**
 * Service for building text-generator prompts for single assessment items
 */
public interface PromptTemplateService {

    /**
     * Build the instruction asking for one multiple-choice item as JSON
     *
     * @param topic      curriculum topic the item should cover
     * @param difficulty difficulty label, passed through verbatim
     * @return formatted prompt string
     */
    String buildItemPrompt(String topic, String difficulty);

    /**
     * Load a prompt template from resources
     *
     * @param templateName the name of the template file under {@code prompts/}
     * @return the template content
     */
    String loadPromptTemplate(String templateName);
}
