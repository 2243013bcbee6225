package uk.gegc.mathassessment.features.export.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.util.Units;
import org.apache.poi.xwpf.usermodel.BreakType;
import org.apache.poi.xwpf.usermodel.Document;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;
import org.springframework.stereotype.Component;
import uk.gegc.mathassessment.features.export.application.ExportRenderer;
import uk.gegc.mathassessment.features.export.domain.model.ExportFile;
import uk.gegc.mathassessment.features.export.domain.model.ExportFormat;
import uk.gegc.mathassessment.features.export.domain.model.ExportPayload;
import uk.gegc.mathassessment.features.export.infra.image.CoordinatePlaneRenderer;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;
import uk.gegc.mathassessment.shared.exception.AssessmentExportException;
import uk.gegc.mathassessment.shared.util.TextSanitizer;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.Optional;

/**
 * Word document with one page per item. Coordinate geometry items get their plane
 * embedded below the explanation.
 * <p>
 * The document title, item headings and section labels use the Word paragraph styles
 * {@value #TITLE_STYLE}, {@value #ITEM_STYLE} and {@value #SECTION_STYLE}, so they show
 * up in the navigation pane. Line breaks inside generated text become run breaks.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DocxExportRenderer implements ExportRenderer {

    static final String DEFAULT_FILENAME = "math_assessment.docx";
    static final String INTRO = "This assessment contains AI-generated questions covering various math topics.";
    static final String CORRECT_MARK = " ✓";
    static final String TITLE_STYLE = "Title";
    static final String ITEM_STYLE = "Heading1";
    static final String SECTION_STYLE = "Heading2";

    private static final String CONTENT_TYPE =
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
    private static final int IMAGE_WIDTH_POINTS = 288;

    private final CoordinatePlaneRenderer coordinatePlaneRenderer;
    private final TextSanitizer textSanitizer;

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.DOCX;
    }

    @Override
    public ExportFile render(ExportPayload payload) {
        try (XWPFDocument document = new XWPFDocument()) {
            addHeadingStyles(document);
            heading(document, TITLE_STYLE, payload.title(), 20);
            document.createParagraph().createRun().setText(INTRO);

            int number = 1;
            for (AssessmentItem item : payload.items()) {
                writeItem(document, item, number++);
            }

            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            document.write(baos);
            byte[] bytes = baos.toByteArray();

            return new ExportFile(
                    payload.filenameOr(DEFAULT_FILENAME),
                    CONTENT_TYPE,
                    () -> new ByteArrayInputStream(bytes),
                    bytes.length
            );
        } catch (AssessmentExportException e) {
            throw e;
        } catch (Exception e) {
            throw new AssessmentExportException("Failed to render DOCX export", e);
        }
    }

    private void writeItem(XWPFDocument document, AssessmentItem item, int number) throws Exception {
        heading(document, ITEM_STYLE, "Question " + number, 14);

        XWPFParagraph question = document.createParagraph();
        bold(question, "Question: ");
        writeLines(question.createRun(), clean(item.question()));

        heading(document, SECTION_STYLE, "Options:", 12);
        for (int i = 0; i < item.options().size(); i++) {
            String label = "(" + (char) ('A' + i) + ") " + clean(item.options().get(i));
            XWPFRun run = document.createParagraph().createRun();
            if (i == item.correctIndex()) {
                run.setBold(true);
                writeLines(run, label + CORRECT_MARK);
            } else {
                writeLines(run, label);
            }
        }

        heading(document, SECTION_STYLE, "Assessment Details", 12);
        detail(document, "Difficulty", item.difficulty());
        detail(document, "Subject", item.subject());
        detail(document, "Unit", item.unit());
        detail(document, "Topic", item.topic());

        XWPFParagraph explanation = document.createParagraph();
        bold(explanation, "Explanation: ");
        writeLines(explanation.createRun(), clean(item.explanation()));

        Optional<byte[]> image = coordinatePlaneRenderer.render(item);
        if (image.isPresent()) {
            XWPFRun run = document.createParagraph().createRun();
            run.addPicture(new ByteArrayInputStream(image.get()), Document.PICTURE_TYPE_PNG,
                    "coordinate_plane_" + number + ".png",
                    Units.toEMU(IMAGE_WIDTH_POINTS), Units.toEMU(IMAGE_WIDTH_POINTS));
            log.debug("Embedded coordinate plane for question {}", number);
        }

        document.createParagraph().createRun().addBreak(BreakType.PAGE);
    }

    // A blank document carries no style definitions, so the heading styles are declared here
    private void addHeadingStyles(XWPFDocument document) {
        XWPFStyles styles = document.createStyles();
        addParagraphStyle(styles, TITLE_STYLE, "Title", null);
        addParagraphStyle(styles, ITEM_STYLE, "heading 1", 0);
        addParagraphStyle(styles, SECTION_STYLE, "heading 2", 1);
    }

    private void addParagraphStyle(XWPFStyles styles, String styleId, String name, Integer outlineLevel) {
        CTStyle ctStyle = CTStyle.Factory.newInstance();
        ctStyle.setStyleId(styleId);
        ctStyle.setType(STStyleType.PARAGRAPH);
        ctStyle.addNewName().setVal(name);
        ctStyle.addNewQFormat();
        if (outlineLevel != null) {
            ctStyle.addNewPPr().addNewOutlineLvl().setVal(BigInteger.valueOf(outlineLevel));
        }
        styles.addStyle(new XWPFStyle(ctStyle, styles));
    }

    private void heading(XWPFDocument document, String styleId, String text, int fontSize) {
        XWPFParagraph paragraph = document.createParagraph();
        paragraph.setStyle(styleId);
        XWPFRun run = paragraph.createRun();
        run.setBold(true);
        run.setFontSize(fontSize);
        run.setText(clean(text));
    }

    private void detail(XWPFDocument document, String label, String value) {
        writeLines(document.createParagraph().createRun(), "• " + label + ": " + clean(value));
    }

    private void writeLines(XWPFRun run, String text) {
        String[] lines = text.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                run.addBreak();
            }
            run.setText(lines[i], i);
        }
    }

    private void bold(XWPFParagraph paragraph, String text) {
        XWPFRun run = paragraph.createRun();
        run.setBold(true);
        run.setText(text);
    }

    private String clean(String value) {
        return textSanitizer.sanitize(value);
    }
}
