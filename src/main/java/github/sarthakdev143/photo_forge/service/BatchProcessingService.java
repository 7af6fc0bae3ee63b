package github.sarthakdev143.photo_forge.service;

import github.sarthakdev143.photo_forge.model.AdjustmentSet;
import github.sarthakdev143.photo_forge.model.BatchJob;
import github.sarthakdev143.photo_forge.model.BatchJobState;
import github.sarthakdev143.photo_forge.model.BatchStatistics;
import github.sarthakdev143.photo_forge.model.ExportOptions;
import github.sarthakdev143.photo_forge.model.QueueStatus;

import java.util.List;
import java.util.Optional;

public interface BatchProcessingService {

    BatchJob createBatchJob(
            String name,
            List<String> inputFiles,
            String outputDirectory,
            AdjustmentSet adjustments,
            ExportOptions exportOptions);

    Optional<BatchJob> createBatchJobFromPreset(
            String name,
            List<String> inputFiles,
            String outputDirectory,
            String presetId,
            ExportOptions exportOptions);

    boolean queueJob(String jobId);

    Optional<BatchJob> getJob(String jobId);

    List<BatchJob> getAllJobs();

    List<BatchJob> getJobsByStatus(BatchJobState state);

    boolean cancelJob(String jobId);

    boolean deleteJob(String jobId);

    int clearCompletedJobs();

    BatchStatistics getStatistics();

    QueueStatus getQueueStatus();

    void setMaxConcurrentJobs(int maxConcurrentJobs);
}
