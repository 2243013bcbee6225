package uk.gegc.mathassessment.features.export.application;

import uk.gegc.mathassessment.features.export.domain.model.ExportFormat;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;

import java.nio.file.Path;
import java.util.List;

public interface AssessmentExportService {

    /**
     * Writes the tagged text and DOCX exports of the items to the configured output directory.
     *
     * @return paths of the written files, text file first
     */
    List<Path> exportAll(List<AssessmentItem> items, String title);

    Path export(List<AssessmentItem> items, String title, ExportFormat format);
}
