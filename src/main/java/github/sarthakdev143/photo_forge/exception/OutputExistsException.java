package github.sarthakdev143.photo_forge.exception;

import java.io.IOException;

/**
 * Raised when an export target exists and overwriting is disabled.
 */
public class OutputExistsException extends IOException {

    public OutputExistsException(String message) {
        super(message);
    }

    public OutputExistsException(String message, Throwable cause) {
        super(message, cause);
    }
}
