package uk.gegc.mathassessment.features.export.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Execution(ExecutionMode.CONCURRENT)
@DisplayName("ExportFile Tests")
class ExportFileTest {

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {" ", "\t"})
    @DisplayName("constructor: null or blank filename throws IllegalArgumentException")
    void constructor_blankFilename_throws(String filename) {
        Supplier<InputStream> supplier = () -> new ByteArrayInputStream(new byte[0]);

        assertThatThrownBy(() -> new ExportFile(filename, "text/plain", supplier, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Filename cannot be null or blank");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {" ", "\n"})
    @DisplayName("constructor: null or blank content type throws IllegalArgumentException")
    void constructor_blankContentType_throws(String contentType) {
        Supplier<InputStream> supplier = () -> new ByteArrayInputStream(new byte[0]);

        assertThatThrownBy(() -> new ExportFile("a.txt", contentType, supplier, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Content type cannot be null or blank");
    }

    @Test
    @DisplayName("constructor: null supplier throws IllegalArgumentException")
    void constructor_nullSupplier_throws() {
        assertThatThrownBy(() -> new ExportFile("a.txt", "text/plain", null, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Content supplier cannot be null");
    }

    @Test
    @DisplayName("constructor: negative length is normalized to unknown")
    void constructor_negativeLength_unknown() {
        ExportFile file = new ExportFile("a.txt", "text/plain", () -> new ByteArrayInputStream(new byte[0]), -42);

        assertThat(file.contentLength()).isEqualTo(-1);
    }

    @Test
    @DisplayName("contentSupplier: content can be read more than once")
    void contentSupplier_readTwice_sameContent() throws IOException {
        byte[] bytes = "@question x".getBytes(StandardCharsets.UTF_8);
        ExportFile file = new ExportFile("a.txt", "text/plain", () -> new ByteArrayInputStream(bytes), bytes.length);

        try (InputStream first = file.contentSupplier().get(); InputStream second = file.contentSupplier().get()) {
            assertThat(first.readAllBytes()).isEqualTo(second.readAllBytes()).isEqualTo(bytes);
        }
    }
}
