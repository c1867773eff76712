package dev.fragmenter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the fragmenter command-line tool.
 *
 * <p>Runs without a web server; the exit code reported by the split command becomes the process
 * exit code.
 */
@SpringBootApplication
public class FragmenterApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(
                SpringApplication.run(FragmenterApplication.class, args)));
    }
}
