package uk.gegc.mathassessment.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties selecting and tuning the external text-generator backend
 */
@Component
@ConfigurationProperties(prefix = "app.generator")
@Validated
@Data
public class GeneratorProperties {

    /**
     * Which backend produces raw item text. {@code NONE} uses the deterministic generators only.
     */
    @NotNull
    private Backend backend = Backend.NONE;

    /**
     * Upper bound on generated tokens per item, forwarded to the chat backend
     */
    @Positive
    private int maxNewTokens = 768;

    @Valid
    private Process process = new Process();

    public enum Backend {
        CHAT,
        PROCESS,
        NONE
    }

    @Data
    public static class Process {

        /**
         * Executable of the local model runner, resolved against PATH
         */
        @NotBlank
        private String command = "ollama";

        @NotBlank
        private String model = "mistral:7b";
    }
}
