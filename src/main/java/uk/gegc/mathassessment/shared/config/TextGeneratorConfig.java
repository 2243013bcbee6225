package uk.gegc.mathassessment.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the chat client used by the chat text-generator backend.
 * Only active when {@code app.generator.backend=chat}.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.generator", name = "backend", havingValue = "chat")
@Slf4j
public class TextGeneratorConfig {

    static final String SYSTEM_PROMPT =
            "You write multiple-choice quantitative math questions and reply with a single JSON object only.";

    @Bean
    public ChatClient assessmentChatClient(ChatClient.Builder builder, GeneratorProperties generatorProperties) {
        log.info("Configuring chat text generator (maxTokens={})", generatorProperties.getMaxNewTokens());
        return builder
                .defaultSystem(SYSTEM_PROMPT)
                .defaultOptions(ChatOptions.builder()
                        .maxTokens(generatorProperties.getMaxNewTokens())
                        .build())
                .build();
    }
}
