package dev.fragmenter.cli;

import dev.fragmenter.splitting.FragmentType;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.stereotype.Component;

/**
 * Writes fragments to disk as {@code fragment_<type>_<index>.<ext>}, e.g. {@code
 * fragment_html_1.html} or {@code fragment_text_3.txt}.
 */
@Component
public class FragmentWriter {

    /**
     * Writes one fragment, creating the output directory if needed.
     *
     * @param outputDir directory receiving the fragment files
     * @param index     1-based position of the fragment in the split
     * @param type      detected type of the source, drives the file name and extension
     * @param fragment  fragment content, written as UTF-8
     * @return the path of the written file
     * @throws UncheckedIOException if the directory or the file cannot be written
     */
    public Path write(Path outputDir, int index, FragmentType type, String fragment) {
        Path file = outputDir.resolve(fileName(index, type));
        try {
            Files.createDirectories(outputDir);
            Files.writeString(file, fragment, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write fragment to " + file, e);
        }
        return file;
    }

    /**
     * Creates the output directory and any missing parents, so a run that yields no fragment still
     * leaves it in place.
     *
     * @throws UncheckedIOException if the directory cannot be created
     */
    public void createOutputDir(Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create output directory " + outputDir, e);
        }
    }

    static String fileName(int index, FragmentType type) {
        return "fragment_%s_%d.%s".formatted(type.value(), index, type.fileExtension());
    }
}
