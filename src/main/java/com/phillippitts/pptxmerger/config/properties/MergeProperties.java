package com.phillippitts.pptxmerger.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the merge engine and its command line.
 *
 * <p>Bound from the {@code merge.*} namespace. Defaults live both here and in
 * {@code application.properties} so the engine also works when constructed directly in tests.
 */
@ConfigurationProperties(prefix = "merge")
@Validated
public class MergeProperties {

    /**
     * Output file used when the command line does not name one.
     */
    @NotBlank
    private String defaultOutput = "merged.pptx";

    /**
     * File extension accepted for inputs (compared case-insensitively).
     */
    @NotBlank
    private String inputExtension = ".pptx";

    /**
     * Prefix of the per-merge scratch directory.
     */
    @NotBlank
    private String workDirPrefix = "pptx-merger-";

    /**
     * Parent of the scratch directory; the system temp directory when unset.
     */
    private String tempDir;

    /**
     * Whether slide masters copied from later inputs are listed in the base presentation.
     */
    private boolean registerMasters = true;

    @Valid
    private Archive archive = new Archive();

    @Valid
    private Cli cli = new Cli();

    public String getDefaultOutput() {
        return defaultOutput;
    }

    public void setDefaultOutput(String defaultOutput) {
        this.defaultOutput = defaultOutput;
    }

    public String getInputExtension() {
        return inputExtension;
    }

    public void setInputExtension(String inputExtension) {
        this.inputExtension = inputExtension;
    }

    public String getWorkDirPrefix() {
        return workDirPrefix;
    }

    public void setWorkDirPrefix(String workDirPrefix) {
        this.workDirPrefix = workDirPrefix;
    }

    public String getTempDir() {
        return tempDir;
    }

    public void setTempDir(String tempDir) {
        this.tempDir = tempDir;
    }

    public boolean isRegisterMasters() {
        return registerMasters;
    }

    public void setRegisterMasters(boolean registerMasters) {
        this.registerMasters = registerMasters;
    }

    public Archive getArchive() {
        return archive;
    }

    public void setArchive(Archive archive) {
        this.archive = archive;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    /**
     * Output archive settings.
     */
    public static class Archive {
        @Min(0)
        @Max(9)
        private int compressionLevel = 6;

        public int getCompressionLevel() {
            return compressionLevel;
        }

        public void setCompressionLevel(int compressionLevel) {
            this.compressionLevel = compressionLevel;
        }
    }

    /**
     * Command line runner settings.
     */
    public static class Cli {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
