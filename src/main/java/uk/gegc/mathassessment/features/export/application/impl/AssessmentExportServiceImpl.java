package uk.gegc.mathassessment.features.export.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.mathassessment.features.export.application.AssessmentExportService;
import uk.gegc.mathassessment.features.export.application.ExportRenderer;
import uk.gegc.mathassessment.features.export.domain.model.ExportFile;
import uk.gegc.mathassessment.features.export.domain.model.ExportFormat;
import uk.gegc.mathassessment.features.export.domain.model.ExportPayload;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;
import uk.gegc.mathassessment.shared.config.AssessmentProperties;
import uk.gegc.mathassessment.shared.exception.AssessmentExportException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class AssessmentExportServiceImpl implements AssessmentExportService {

    private final List<ExportRenderer> renderers;
    private final AssessmentProperties properties;

    @Override
    public List<Path> exportAll(List<AssessmentItem> items, String title) {
        return List.of(
                export(items, title, ExportFormat.TAGGED_TEXT),
                export(items, title, ExportFormat.DOCX)
        );
    }

    @Override
    public Path export(List<AssessmentItem> items, String title, ExportFormat format) {
        ExportPayload payload = new ExportPayload(title, items, filenameFor(format));
        ExportFile file = resolveRenderer(format).render(payload);

        Path outputDir = Path.of(properties.getOutputDir());
        Path target = outputDir.resolve(file.filename());
        try (InputStream in = file.contentSupplier().get()) {
            Files.createDirectories(outputDir);
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new AssessmentExportException("Failed to write " + format + " export to " + target, e);
        }

        log.info("Exported {} item(s) as {} to {}", items.size(), format, target.toAbsolutePath());
        return target;
    }

    private String filenameFor(ExportFormat format) {
        return switch (format) {
            case TAGGED_TEXT -> properties.getTextFilename();
            case DOCX -> properties.getDocxFilename();
        };
    }

    private ExportRenderer resolveRenderer(ExportFormat format) {
        return renderers.stream()
                .filter(r -> r.supports(format))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported export format: " + format));
    }
}
