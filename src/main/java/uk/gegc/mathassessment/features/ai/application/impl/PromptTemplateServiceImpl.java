package uk.gegc.mathassessment.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import uk.gegc.mathassessment.features.ai.application.PromptTemplateService;
import uk.gegc.mathassessment.features.ai.infra.schema.ItemResponseSchema;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Implementation of PromptTemplateService for building item prompts
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PromptTemplateServiceImpl implements PromptTemplateService {

    static final String ITEM_TEMPLATE = "item/single-item.txt";

    private final ResourceLoader resourceLoader;
    private final Map<String, String> templateCache = new ConcurrentHashMap<>();

    @Override
    public String buildItemPrompt(String topic, String difficulty) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Topic cannot be null or empty");
        }
        if (difficulty == null || difficulty.isBlank()) {
            throw new IllegalArgumentException("Difficulty cannot be null or empty");
        }

        String schema = ItemResponseSchema.describe();
        try {
            return loadPromptTemplate(ITEM_TEMPLATE)
                    .replace("{topic}", topic)
                    .replace("{difficulty}", difficulty)
                    .replace("{schema}", schema);
        } catch (Exception e) {
            log.error("Error building prompt for topic: {}", topic, e);
            // Fallback to inline prompt
            return String.format("""
                    Generate ONE multiple-choice math question as JSON ONLY (no extra text).
                    Topic: %s
                    Difficulty: %s
                    Requirements:
                    - Use LaTeX for math (e.g., $x^2$, \\frac{a}{b}).
                    - Provide EXACTLY 5 unique options in an array.
                    - Set correct_index to the correct option's index (0-4).
                    - Keys must be: question, options, correct_index, explanation.

                    Return a compact JSON matching this schema: %s
                    """, topic, difficulty, schema);
        }
    }

    @Override
    public String loadPromptTemplate(String templateName) {
        return templateCache.computeIfAbsent(templateName, this::loadTemplateFromResources);
    }

    private String loadTemplateFromResources(String templateName) {
        Resource resource = resourceLoader.getResource("classpath:prompts/" + templateName);
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to load template: {}", templateName, e);
            throw new IllegalStateException("Failed to load template: " + templateName, e);
        }
    }
}
