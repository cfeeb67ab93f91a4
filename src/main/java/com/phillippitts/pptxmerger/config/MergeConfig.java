package com.phillippitts.pptxmerger.config;

import com.phillippitts.pptxmerger.config.properties.MergeProperties;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Validates MergeProperties combinations at startup to fail fast with actionable messages.
 * Single-field constraints are covered by bean validation on the properties class.
 */
@Configuration
public class MergeConfig {

    private final MergeProperties props;

    public MergeConfig(MergeProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        String extension = props.getInputExtension();
        if (extension == null || !extension.startsWith(".") || extension.length() < 2) {
            throw new IllegalArgumentException("Invalid merge.input-extension: '" + extension
                    + "'. Must start with '.' followed by at least one character, e.g. '.pptx'.");
        }
        String output = props.getDefaultOutput();
        if (output == null || !output.toLowerCase(Locale.ROOT).endsWith(extension.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Invalid merge.default-output: '" + output
                    + "'. Must end with merge.input-extension (" + extension + ").");
        }
        String tempDir = props.getTempDir();
        if (tempDir != null && !tempDir.isBlank()) {
            try {
                if (!Files.isDirectory(Path.of(tempDir))) {
                    throw new IllegalArgumentException("merge.temp-dir does not exist or is not a directory: " + tempDir);
                }
            } catch (InvalidPathException e) {
                throw new IllegalArgumentException("Invalid merge.temp-dir: '" + tempDir + "'", e);
            }
        }
    }
}
