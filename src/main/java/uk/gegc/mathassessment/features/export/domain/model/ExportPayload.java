package uk.gegc.mathassessment.features.export.domain.model;

import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;

import java.util.List;

/**
 * Items and presentation settings handed to an ExportRenderer.
 *
 * @param title    assessment title shown before the first item
 * @param items    items in display order
 * @param filename target file name; renderers use their own default when blank
 */
public record ExportPayload(
    String title,
    List<AssessmentItem> items,
    String filename
) {
    public static final String DEFAULT_TITLE = "AI-Generated Quantitative Math Assessment";

    public ExportPayload {
        if (items == null) {
            throw new IllegalArgumentException("Items list cannot be null");
        }
        items = List.copyOf(items);
        if (title == null || title.isBlank()) {
            title = DEFAULT_TITLE;
        }
    }

    public String filenameOr(String defaultFilename) {
        return filename == null || filename.isBlank() ? defaultFilename : filename;
    }
}
