package uk.gegc.mathassessment.features.export.domain.model;

import java.io.InputStream;
import java.util.function.Supplier;

/**
 * Represents a rendered export ready to be written out.
 * Uses a supplier so the content can be streamed more than once.
 */
public record ExportFile(
    String filename,
    String contentType,
    Supplier<InputStream> contentSupplier,
    long contentLength
) {
    public ExportFile {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Filename cannot be null or blank");
        }
        if (contentType == null || contentType.isBlank()) {
            throw new IllegalArgumentException("Content type cannot be null or blank");
        }
        if (contentSupplier == null) {
            throw new IllegalArgumentException("Content supplier cannot be null");
        }
        if (contentLength < 0) {
            contentLength = -1; // Unknown length
        }
    }
}
