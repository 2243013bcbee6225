package uk.gegc.mathassessment.features.export.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.mathassessment.features.export.ExportFixtures;
import uk.gegc.mathassessment.features.export.domain.model.ExportFile;
import uk.gegc.mathassessment.features.export.domain.model.ExportFormat;
import uk.gegc.mathassessment.features.export.domain.model.ExportPayload;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;
import uk.gegc.mathassessment.shared.util.TextSanitizer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TaggedTextExportRenderer Tests")
class TaggedTextExportRendererTest {

    private final TaggedTextExportRenderer renderer = new TaggedTextExportRenderer(new TextSanitizer());

    private static String content(ExportFile file) throws IOException {
        try (InputStream in = file.contentSupplier().get()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    @DisplayName("supports: only the tagged text format")
    void supports_formats() {
        assertThat(renderer.supports(ExportFormat.TAGGED_TEXT)).isTrue();
        assertThat(renderer.supports(ExportFormat.DOCX)).isFalse();
    }

    @Test
    @DisplayName("render: writes header, tagged fields and marks the correct option")
    void render_singleItem_exactFormat() throws IOException {
        // Given
        ExportPayload payload = new ExportPayload("Practice Test", List.of(ExportFixtures.circleItem()), null);

        // When
        ExportFile file = renderer.render(payload);

        // Then
        assertThat(content(file)).isEqualTo("""
                @title Practice Test
                @description Comprehensive math assessment covering various curriculum topics

                @question A circle has a radius of 5 units. What is the area of the circle?
                @instruction Choose the correct option
                @difficulty moderate
                @Order 1
                @option $10\\pi$
                @@option $25\\pi$
                @option $5\\pi$
                @option $50\\pi$
                @option $12\\pi$
                @explanation $A=\\pi r^2=25\\pi$
                @subject Quantitative Math
                @unit Geometry and Measurement
                @topic Circles (Area, circumference)
                @plusmarks 1
                """);
        assertThat(file.filename()).isEqualTo("assessment_questions.txt");
        assertThat(file.contentType()).startsWith("text/plain");
        assertThat(file.contentLength()).isEqualTo(content(file).getBytes(StandardCharsets.UTF_8).length);
    }

    @Test
    @DisplayName("render: numbers items and writes the header only once")
    void render_twoItems_numberedWithSingleHeader() throws IOException {
        ExportPayload payload = new ExportPayload("T",
                List.of(ExportFixtures.circleItem(), ExportFixtures.coordinateItem()), "out.txt");

        String text = content(renderer.render(payload));

        assertThat(text).containsOnlyOnce("@title T").contains("@Order 1").contains("@Order 2");
        assertThat(text).contains("@plusmarks 1\n\n@question Which point");
        assertThat(text).contains("@@option C");
        assertThat(text.lines().filter(l -> l.startsWith("@@option"))).hasSize(2);
        assertThat(renderer.render(payload).filename()).isEqualTo("out.txt");
    }

    @Test
    @DisplayName("render: control characters are stripped from text fields")
    void render_controlCharacters_stripped() throws IOException {
        AssessmentItem item = ExportFixtures.circleItem().toBuilder()
                .question("What\u0007 is  this? ")
                .build();

        String text = content(renderer.render(new ExportPayload("T", List.of(item), null)));

        assertThat(text).contains("@question What is  this?\n");
    }

    @Test
    @DisplayName("render: empty item list writes nothing")
    void render_noItems_empty() throws IOException {
        ExportFile file = renderer.render(new ExportPayload("T", List.of(), null));

        assertThat(content(file)).isEmpty();
        assertThat(file.contentLength()).isZero();
    }
}
