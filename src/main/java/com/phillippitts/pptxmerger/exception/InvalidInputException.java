package com.phillippitts.pptxmerger.exception;

/**
 * Thrown when the caller supplies no usable inputs: an empty list, a path that does not exist,
 * a file with the wrong extension, or an aborted interactive ordering.
 */
public class InvalidInputException extends PptxMergerException {

    private final String input;

    public InvalidInputException(String message) {
        super(message);
        this.input = null;
    }

    public InvalidInputException(String input, String reason) {
        super("Invalid input '" + input + "': " + reason);
        this.input = input;
    }

    /**
     * @return offending input as given by the caller, or {@code null} when the failure is not
     *         tied to a single input
     */
    public String getInput() {
        return input;
    }
}
