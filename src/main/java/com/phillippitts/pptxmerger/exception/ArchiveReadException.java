package com.phillippitts.pptxmerger.exception;

import java.nio.file.Path;

/**
 * Thrown when an input package cannot be read as a zip archive
 * (corrupt file, not a zip, or an entry that would escape the extraction directory).
 */
public class ArchiveReadException extends PptxMergerException {

    private final Path archivePath;

    public ArchiveReadException(Path archivePath, String reason) {
        super("Cannot read package archive " + archivePath + ": " + reason);
        this.archivePath = archivePath;
    }

    public ArchiveReadException(Path archivePath, String reason, Throwable cause) {
        super("Cannot read package archive " + archivePath + ": " + reason, cause);
        this.archivePath = archivePath;
    }

    public Path getArchivePath() {
        return archivePath;
    }
}
