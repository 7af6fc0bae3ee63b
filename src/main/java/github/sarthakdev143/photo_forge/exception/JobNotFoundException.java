package github.sarthakdev143.photo_forge.exception;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(String jobId) {
        super("Job not found for id: " + jobId);
    }
}
