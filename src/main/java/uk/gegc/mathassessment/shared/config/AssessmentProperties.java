package uk.gegc.mathassessment.shared.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for a generated assessment run and its exports
 */
@Component
@ConfigurationProperties(prefix = "app.assessment")
@Validated
@Data
public class AssessmentProperties {

    /**
     * Number of items to generate
     */
    @Min(0)
    private int count = 2;

    /**
     * Title written at the top of every export
     */
    @NotBlank
    private String title = "AI-Generated Quantitative Math Assessment";

    /**
     * Directory the export files are written to
     */
    @NotBlank
    private String outputDir = ".";

    @NotBlank
    private String textFilename = "assessment_questions.txt";

    @NotBlank
    private String docxFilename = "math_assessment.docx";

    /**
     * Whether the command-line runner generates and exports an assessment on startup
     */
    private boolean runOnStartup = true;
}
