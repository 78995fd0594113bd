package io.lineprofile.analyzer.output;

/**
 * Runtime exception for output directory or file write failures.
 */
public class OutputWriteException extends RuntimeException {

    public OutputWriteException(String message) {
        super(message);
    }

    public OutputWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
