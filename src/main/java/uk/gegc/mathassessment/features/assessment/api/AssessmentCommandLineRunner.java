package uk.gegc.mathassessment.features.assessment.api;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import uk.gegc.mathassessment.features.assessment.application.AssessmentGenerationService;
import uk.gegc.mathassessment.features.export.application.AssessmentExportService;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;
import uk.gegc.mathassessment.shared.config.AssessmentProperties;

import java.nio.file.Path;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class AssessmentCommandLineRunner implements CommandLineRunner {

    private final AssessmentGenerationService assessmentGenerationService;
    private final AssessmentExportService assessmentExportService;
    private final AssessmentProperties properties;

    @Override
    public void run(String... args) {
        if (!properties.isRunOnStartup()) {
            log.info("Assessment generation on startup is disabled");
            return;
        }

        List<AssessmentItem> items = assessmentGenerationService.generateAssessment(properties.getCount());
        for (int i = 0; i < items.size(); i++) {
            AssessmentItem item = items.get(i);
            log.info("Q{} [{} / {}]: {} -> {}", i + 1, item.topic(), item.difficulty(),
                    item.question(), item.correctOption());
        }

        List<Path> written = assessmentExportService.exportAll(items, properties.getTitle());
        log.info("Assessment written to {}", written);
    }
}
