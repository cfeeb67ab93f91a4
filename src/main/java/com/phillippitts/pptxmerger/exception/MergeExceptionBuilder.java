package com.phillippitts.pptxmerger.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing MergeException with contextual information about the
 * package and part that were being processed.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw MergeExceptionBuilder.create("Failed to copy part")
 *         .source("quarterly.pptx")
 *         .part("slides/slide3.xml")
 *         .cause(ioException)
 *         .metadata("destination", "slides/slide9.xml")
 *         .build();
 * </pre>
 */
public final class MergeExceptionBuilder {

    private final String message;
    private String sourceName;
    private String partPath;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private MergeExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static MergeExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new MergeExceptionBuilder(message);
    }

    /**
     * Sets the name of the source package being merged.
     *
     * @param sourceName file name of the source package
     * @return this builder for chaining
     */
    public MergeExceptionBuilder source(String sourceName) {
        this.sourceName = sourceName;
        return this;
    }

    /**
     * Sets the content-root relative path of the part being processed.
     *
     * @param partPath part path such as {@code slides/slide3.xml}
     * @return this builder for chaining
     */
    public MergeExceptionBuilder part(String partPath) {
        this.partPath = partPath;
        return this;
    }

    /**
     * Sets the root cause of the exception.
     *
     * @param cause underlying exception
     * @return this builder for chaining
     */
    public MergeExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public MergeExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the MergeException with the configured properties.
     *
     * <p>The final message format is:
     * <pre>
     * {message} (part={part}, {key1}={val1}, ...) (source: {source})
     * </pre>
     *
     * @return constructed MergeException
     */
    public MergeException build() {
        String detailedMessage = buildDetailedMessage();
        String source = sourceName != null ? sourceName : "unknown";

        if (cause != null) {
            return new MergeException(detailedMessage, source, cause);
        } else {
            return new MergeException(detailedMessage, source);
        }
    }

    private String buildDetailedMessage() {
        boolean hasDetails = partPath != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (partPath != null) {
            sb.append("part=").append(partPath);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        sb.append(")");
        return sb.toString();
    }
}
