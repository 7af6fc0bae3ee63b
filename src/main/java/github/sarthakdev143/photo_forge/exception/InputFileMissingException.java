package github.sarthakdev143.photo_forge.exception;

import java.io.IOException;

public class InputFileMissingException extends IOException {

    public InputFileMissingException(String message) {
        super(message);
    }

    public InputFileMissingException(String message, Throwable cause) {
        super(message, cause);
    }
}
