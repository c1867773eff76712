package dev.fragmenter.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the split command.
 *
 * <p>Properties are bound from {@code fragmenter.*} in application.yml / application.properties.
 *
 * <ul>
 *   <li>{@code max-length} - byte budget per fragment when {@code --max-len} is not given (default
 *       4096). Non-positive values are accepted and produce no fragments.
 *   <li>{@code output-dir} - directory fragment files are written to when {@code --output-dir} is
 *       not given (default {@code fragments})
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "fragmenter")
public class FragmenterProperties {

  static final int DEFAULT_MAX_LENGTH = 4096;
  static final String DEFAULT_OUTPUT_DIR = "fragments";

  private int maxLength = DEFAULT_MAX_LENGTH;
  private String outputDir = DEFAULT_OUTPUT_DIR;

  /** Validates configuration at startup. Throws if the output directory is missing. */
  @PostConstruct
  void validate() {
    if (outputDir == null || outputDir.isBlank()) {
      throw new IllegalStateException("fragmenter.output-dir must not be blank");
    }
  }

  public int getMaxLength() {
    return maxLength;
  }

  public void setMaxLength(int maxLength) {
    this.maxLength = maxLength;
  }

  public String getOutputDir() {
    return outputDir;
  }

  public void setOutputDir(String outputDir) {
    this.outputDir = outputDir;
  }
}
