package com.phillippitts.pptxmerger.exception;

/**
 * Base exception for all pptx-merger application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class PptxMergerException extends RuntimeException {

    public PptxMergerException(String message) {
        super(message);
    }

    public PptxMergerException(String message, Throwable cause) {
        super(message, cause);
    }

    public PptxMergerException(Throwable cause) {
        super(cause);
    }
}
