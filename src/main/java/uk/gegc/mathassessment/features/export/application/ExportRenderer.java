package uk.gegc.mathassessment.features.export.application;

import uk.gegc.mathassessment.features.export.domain.model.ExportFile;
import uk.gegc.mathassessment.features.export.domain.model.ExportFormat;
import uk.gegc.mathassessment.features.export.domain.model.ExportPayload;

/**
 * SPI for rendering generated items into exportable files.
 * Renderers only read the items they are given.
 */
public interface ExportRenderer {
    boolean supports(ExportFormat format);

    ExportFile render(ExportPayload payload);
}
