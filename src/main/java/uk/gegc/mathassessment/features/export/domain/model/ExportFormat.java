package uk.gegc.mathassessment.features.export.domain.model;

public enum ExportFormat {
    /** Line-oriented {@code @tag value} format for import into assessment platforms */
    TAGGED_TEXT,
    /** Word document with embedded coordinate-plane illustrations */
    DOCX
}
