package github.sarthakdev143.photo_forge.model;

import java.util.Collection;

public record BatchStatistics(
        int total,
        int pending,
        int processing,
        int completed,
        int failed,
        long totalFilesProcessed,
        long totalFilesQueued,
        long totalErrors) {

    public static BatchStatistics of(Collection<BatchJob> jobs) {
        int pending = 0;
        int processing = 0;
        int completed = 0;
        int failed = 0;
        long filesProcessed = 0;
        long filesQueued = 0;
        long errors = 0;

        for (BatchJob job : jobs) {
            switch (job.state()) {
                case PENDING -> pending++;
                case PROCESSING -> processing++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
            }
            filesProcessed += job.processedFiles();
            filesQueued += job.totalFiles();
            errors += job.errors().size();
        }

        return new BatchStatistics(
                jobs.size(),
                pending,
                processing,
                completed,
                failed,
                filesProcessed,
                filesQueued,
                errors);
    }
}
