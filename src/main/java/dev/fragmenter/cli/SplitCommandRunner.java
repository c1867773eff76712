package dev.fragmenter.cli;

import dev.fragmenter.config.FragmenterProperties;
import dev.fragmenter.splitting.ContentSplitter;
import dev.fragmenter.splitting.FragmentType;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Command-line adapter: reads a file (or standard input), splits it and writes one file per
 * fragment.
 *
 * <p>Usage: {@code fragmenter [--max-len=N] [--output-dir=DIR] [FILE|-]}. Without a file argument,
 * or with {@code -}, content is read from standard input. For every fragment a {@code fragment #i:
 * N bytes.} line is printed to standard output, followed by a separator line.
 *
 * <p>Failures (unreadable input, rejected content, unwritable output) are logged and reported
 * through the exit code, never thrown out of {@link #run(ApplicationArguments)}.
 */
@Component
@ConditionalOnProperty(
        prefix = "fragmenter.cli",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true)
public class SplitCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(SplitCommandRunner.class);

    static final String MAX_LENGTH_OPTION = "max-len";
    static final String OUTPUT_DIR_OPTION = "output-dir";
    static final String STDIN_ARGUMENT = "-";
    static final String SEPARATOR = "-".repeat(20);

    private final ContentSplitter splitter;
    private final FragmentWriter writer;
    private final FragmenterProperties properties;
    private final InputStream stdin;
    private final PrintStream stdout;
    private int exitCode;

    @Autowired
    public SplitCommandRunner(ContentSplitter splitter,
                              FragmentWriter writer,
                              FragmenterProperties properties) {
        this(splitter, writer, properties, System.in, System.out);
    }

    SplitCommandRunner(ContentSplitter splitter,
                       FragmentWriter writer,
                       FragmenterProperties properties,
                       InputStream stdin,
                       PrintStream stdout) {
        this.splitter = splitter;
        this.writer = writer;
        this.properties = properties;
        this.stdin = stdin;
        this.stdout = stdout;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Runs one split.
     *
     * @param args parsed command-line arguments
     * @return 0 on success, 1 on failure
     */
    int execute(ApplicationArguments args) {
        try {
            int maxLength = maxLength(args);
            Path outputDir = outputDir(args);
            String content = readInput(args);
            writer.createOutputDir(outputDir);

            FragmentType type = splitter.classify(content);
            int count = 0;
            try (Stream<String> fragments = splitter.splitContent(content, maxLength)) {
                Iterator<String> iterator = fragments.iterator();
                while (iterator.hasNext()) {
                    String fragment = iterator.next();
                    count++;
                    int bytes = fragment.getBytes(StandardCharsets.UTF_8).length;
                    stdout.printf("fragment #%d: %d bytes.%n", count, bytes);
                    stdout.println(SEPARATOR);
                    writer.write(outputDir, count, type, fragment);
                }
            }
            log.info("Wrote {} {} fragment(s) to {}", count, type.value(), outputDir);
            return 0;
        } catch (IllegalArgumentException e) {
            log.error("Cannot split input: {}", e.getMessage(), e);
            return 1;
        } catch (UncheckedIOException e) {
            log.error("I/O failure: {}", e.getMessage(), e);
            return 1;
        }
    }

    private int maxLength(ApplicationArguments args) {
        List<String> values = args.getOptionValues(MAX_LENGTH_OPTION);
        if (values == null || values.isEmpty()) {
            return properties.getMaxLength();
        }
        String value = values.get(values.size() - 1);
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "--" + MAX_LENGTH_OPTION + " must be an integer, got: " + value, e);
        }
    }

    private Path outputDir(ApplicationArguments args) {
        List<String> values = args.getOptionValues(OUTPUT_DIR_OPTION);
        if (values == null || values.isEmpty() || values.get(values.size() - 1).isBlank()) {
            return Path.of(properties.getOutputDir());
        }
        return Path.of(values.get(values.size() - 1));
    }

    private String readInput(ApplicationArguments args) {
        List<String> files = args.getNonOptionArgs();
        if (files.size() > 1) {
            throw new IllegalArgumentException("Expected at most one input file, got: " + files);
        }
        String source = files.isEmpty() ? STDIN_ARGUMENT : files.get(0);
        try {
            if (STDIN_ARGUMENT.equals(source)) {
                return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
            }
            return Files.readString(Path.of(source), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read input from " + source, e);
        }
    }
}
