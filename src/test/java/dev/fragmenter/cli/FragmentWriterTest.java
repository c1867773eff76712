package dev.fragmenter.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.fragmenter.splitting.FragmentType;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FragmentWriterTest {

    @TempDir
    Path tempDir;

    private final FragmentWriter writer = new FragmentWriter();

    @Test
    void fileNameCarriesTypeIndexAndExtension() {
        assertThat(FragmentWriter.fileName(1, FragmentType.HTML)).isEqualTo("fragment_html_1.html");
        assertThat(FragmentWriter.fileName(12, FragmentType.TEXT)).isEqualTo("fragment_text_12.txt");
    }

    @Test
    void writesFragmentAsUtf8() throws IOException {
        Path file = writer.write(tempDir, 3, FragmentType.TEXT, "Grüße 👋");

        assertThat(file).isEqualTo(tempDir.resolve("fragment_text_3.txt"));
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo("Grüße 👋");
    }

    @Test
    void createsMissingOutputDirectory() {
        Path outputDir = tempDir.resolve("nested/fragments");

        Path file = writer.write(outputDir, 1, FragmentType.HTML, "<p>x</p>");

        assertThat(outputDir).isDirectory();
        assertThat(file).hasContent("<p>x</p>");
    }

    @Test
    void overwritesExistingFragment() {
        writer.write(tempDir, 1, FragmentType.TEXT, "old");

        Path file = writer.write(tempDir, 1, FragmentType.TEXT, "new");

        assertThat(file).hasContent("new");
    }

    @Test
    void createOutputDirCreatesParentsAndToleratesExistingDirectory() {
        Path outputDir = tempDir.resolve("x/y");

        writer.createOutputDir(outputDir);
        writer.createOutputDir(outputDir);

        assertThat(outputDir).isEmptyDirectory();
    }

    @Test
    void createOutputDirFailsWhenPathIsAFile() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");

        assertThatThrownBy(() -> writer.createOutputDir(blocker))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("blocker");
    }

    @Test
    void failsWhenOutputDirectoryIsAFile() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");

        assertThatThrownBy(() -> writer.write(blocker, 1, FragmentType.TEXT, "x"))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("fragment_text_1.txt");
    }
}
