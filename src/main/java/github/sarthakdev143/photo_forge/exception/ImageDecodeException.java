package github.sarthakdev143.photo_forge.exception;

import java.io.IOException;

/**
 * Raised when a source image cannot be read or decoded.
 */
public class ImageDecodeException extends IOException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
