package uk.gegc.mathassessment.features.export.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.mathassessment.features.export.application.ExportRenderer;
import uk.gegc.mathassessment.features.export.domain.model.ExportFile;
import uk.gegc.mathassessment.features.export.domain.model.ExportFormat;
import uk.gegc.mathassessment.features.export.domain.model.ExportPayload;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;
import uk.gegc.mathassessment.shared.util.TextSanitizer;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders items in the {@code @tag value} text format. The correct option is tagged
 * {@code @@option}, every other option {@code @option}.
 */
@Component
@RequiredArgsConstructor
public class TaggedTextExportRenderer implements ExportRenderer {

    static final String DEFAULT_FILENAME = "assessment_questions.txt";
    static final String DESCRIPTION = "Comprehensive math assessment covering various curriculum topics";

    private final TextSanitizer textSanitizer;

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.TAGGED_TEXT;
    }

    @Override
    public ExportFile render(ExportPayload payload) {
        List<String> blocks = new ArrayList<>();
        int number = 1;
        for (AssessmentItem item : payload.items()) {
            blocks.add(formatItem(item, number++, payload.title()));
        }
        byte[] bytes = String.join("\n", blocks).getBytes(StandardCharsets.UTF_8);

        return new ExportFile(
                payload.filenameOr(DEFAULT_FILENAME),
                "text/plain; charset=utf-8",
                () -> new ByteArrayInputStream(bytes),
                bytes.length
        );
    }

    String formatItem(AssessmentItem item, int number, String title) {
        List<String> lines = new ArrayList<>();
        if (number == 1) {
            lines.add("@title " + clean(title));
            lines.add("@description " + DESCRIPTION);
            lines.add("");
        }
        lines.add("@question " + clean(item.question()));
        lines.add("@instruction Choose the correct option");
        lines.add("@difficulty " + clean(item.difficulty()));
        lines.add("@Order " + number);
        for (int i = 0; i < item.options().size(); i++) {
            String tag = i == item.correctIndex() ? "@@option" : "@option";
            lines.add(tag + " " + clean(item.options().get(i)));
        }
        lines.add("@explanation " + clean(item.explanation()));
        lines.add("@subject " + clean(item.subject()));
        lines.add("@unit " + clean(item.unit()));
        lines.add("@topic " + clean(item.topic()));
        lines.add("@plusmarks 1");
        lines.add("");
        return String.join("\n", lines);
    }

    private String clean(String value) {
        return textSanitizer.sanitize(value);
    }
}
