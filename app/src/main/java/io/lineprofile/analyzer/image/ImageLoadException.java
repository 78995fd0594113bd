package io.lineprofile.analyzer.image;

/**
 * Runtime exception raised when an input image is missing or cannot be decoded.
 */
public class ImageLoadException extends RuntimeException {

    public ImageLoadException(String message) {
        super(message);
    }

    public ImageLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
