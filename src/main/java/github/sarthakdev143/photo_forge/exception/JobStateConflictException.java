package github.sarthakdev143.photo_forge.exception;

/**
 * Raised when an operation is not allowed in the job's current state.
 */
public class JobStateConflictException extends IllegalStateException {

    public JobStateConflictException(String message) {
        super(message);
    }
}
