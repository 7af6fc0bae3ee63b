package github.sarthakdev143.photo_forge.exception;

import java.io.IOException;

public class OutputDirectoryException extends IOException {

    public OutputDirectoryException(String message) {
        super(message);
    }

    public OutputDirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
