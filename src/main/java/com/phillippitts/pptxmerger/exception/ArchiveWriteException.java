package com.phillippitts.pptxmerger.exception;

import java.nio.file.Path;

/**
 * Thrown when the merged package, or one of its parts, cannot be written to disk.
 * A write failure aborts the whole merge; no partial output is left behind.
 */
public class ArchiveWriteException extends PptxMergerException {

    private final Path targetPath;

    public ArchiveWriteException(Path targetPath, Throwable cause) {
        super("Cannot write " + targetPath + ": " + cause.getMessage(), cause);
        this.targetPath = targetPath;
    }

    public ArchiveWriteException(Path targetPath, String reason) {
        super("Cannot write " + targetPath + ": " + reason);
        this.targetPath = targetPath;
    }

    public Path getTargetPath() {
        return targetPath;
    }
}
