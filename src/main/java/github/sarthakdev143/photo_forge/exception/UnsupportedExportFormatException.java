package github.sarthakdev143.photo_forge.exception;

public class UnsupportedExportFormatException extends IllegalArgumentException {

    public UnsupportedExportFormatException(String message) {
        super(message);
    }
}
