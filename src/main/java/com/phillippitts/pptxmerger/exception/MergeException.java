package com.phillippitts.pptxmerger.exception;

/**
 * Thrown when the copy/merge pass fails for a reason not covered by a more specific exception.
 * Carries the source package being merged, when known.
 */
public class MergeException extends PptxMergerException {

    private final String sourceName;

    public MergeException(String message) {
        super(message);
        this.sourceName = "unknown";
    }

    public MergeException(String message, String sourceName) {
        super(message + " (source: " + sourceName + ")");
        this.sourceName = sourceName;
    }

    public MergeException(String message, Throwable cause) {
        super(message, cause);
        this.sourceName = "unknown";
    }

    public MergeException(String message, String sourceName, Throwable cause) {
        super(message + " (source: " + sourceName + ")", cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
