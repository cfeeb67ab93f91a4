package com.phillippitts.pptxmerger.exception;

import java.nio.file.Path;

/**
 * Thrown when an XML part (presentation, relationships or content-type manifest) is malformed
 * or cannot be read. Malformed XML is never repaired.
 */
public class PartParseException extends PptxMergerException {

    private final Path partPath;

    public PartParseException(Path partPath, Throwable cause) {
        super("Malformed XML part " + partPath + ": " + cause.getMessage(), cause);
        this.partPath = partPath;
    }

    public PartParseException(Path partPath, String reason) {
        super("Malformed XML part " + partPath + ": " + reason);
        this.partPath = partPath;
    }

    public Path getPartPath() {
        return partPath;
    }
}
