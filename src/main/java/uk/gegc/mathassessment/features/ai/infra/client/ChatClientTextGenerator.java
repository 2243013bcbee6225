package uk.gegc.mathassessment.features.ai.infra.client;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import uk.gegc.mathassessment.features.ai.api.dto.GenerationOutcome;
import uk.gegc.mathassessment.features.ai.api.dto.GenerationOutcome.FailureReason;
import uk.gegc.mathassessment.features.ai.application.TextGenerator;
import uk.gegc.mathassessment.features.ai.infra.parser.JsonBlockExtractor;

import java.time.Duration;
import java.time.Instant;

/**
 * Text generator backed by a Spring AI chat model. One blocking call per prompt,
 * no retries.
 */
@Component
@ConditionalOnProperty(prefix = "app.generator", name = "backend", havingValue = "chat")
@RequiredArgsConstructor
@Slf4j
public class ChatClientTextGenerator implements TextGenerator {

    private final ChatClient chatClient;
    private final JsonBlockExtractor jsonBlockExtractor;

    @Override
    public GenerationOutcome generate(String prompt) {
        Instant start = Instant.now();
        try {
            ChatResponse response = chatClient.prompt()
                    .user(prompt)
                    .call()
                    .chatResponse();

            if (response == null || response.getResult() == null) {
                return GenerationOutcome.failure(FailureReason.BACKEND_FAILURE,
                        "No response received from chat model");
            }

            String text = response.getResult().getOutput().getText();
            log.debug("Chat model replied in {}ms: {}",
                    Duration.between(start, Instant.now()).toMillis(), text);
            return jsonBlockExtractor.toOutcome(text);

        } catch (Exception e) {
            log.warn("Chat model call failed: {}", e.getMessage());
            return GenerationOutcome.failure(FailureReason.BACKEND_FAILURE, e.getMessage());
        }
    }

    @Override
    public String name() {
        return "chat";
    }
}
