package github.sarthakdev143.photo_forge.service.impl;

import github.sarthakdev143.photo_forge.config.BatchExecutorConfig;
import github.sarthakdev143.photo_forge.config.PhotoForgeProperties;
import github.sarthakdev143.photo_forge.exception.InputFileMissingException;
import github.sarthakdev143.photo_forge.exception.OutputDirectoryException;
import github.sarthakdev143.photo_forge.exception.OutputExistsException;
import github.sarthakdev143.photo_forge.model.AdjustmentSet;
import github.sarthakdev143.photo_forge.model.BatchJob;
import github.sarthakdev143.photo_forge.model.BatchJobState;
import github.sarthakdev143.photo_forge.model.BatchStatistics;
import github.sarthakdev143.photo_forge.model.ExportOptions;
import github.sarthakdev143.photo_forge.model.QueueStatus;
import github.sarthakdev143.photo_forge.service.AdjustmentPipeline;
import github.sarthakdev143.photo_forge.service.BatchProcessingService;
import github.sarthakdev143.photo_forge.service.ImageBackend;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO batch scheduler. Jobs wait in the admission queue until fewer than {@code maxConcurrentJobs}
 * jobs are PROCESSING; the PENDING to PROCESSING transition happens under the admission lock so the
 * cap holds at every instant.
 * <p>
 * Files of one job are processed one at a time in input order, so at most one file per job is in
 * flight and the output-exists check always sees the files written earlier in the same job. A failing
 * file is recorded as an error and never stops the job.
 */
@Service
public class DefaultBatchProcessingService implements BatchProcessingService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultBatchProcessingService.class);
    static final String JOB_ID_PREFIX = "batch-";
    static final String CANCELLED_MESSAGE = "Job cancelled by user";
    static final String DIRECTORY_FAILURE_PREFIX = "Failed to create output directory: ";
    static final String INPUT_MISSING_MESSAGE = "Input file does not exist";
    static final String OUTPUT_EXISTS_MESSAGE = "Output file exists and overwrite is disabled";
    static final String ABORTED_MESSAGE = "Processing aborted";

    private final JobRegistry registry;
    private final ImageBackend backend;
    private final AdjustmentPipeline pipeline;
    private final ExportEncoder exportEncoder;
    private final PresetResolver presetResolver;
    private final TaskExecutor jobExecutor;
    private final ReentrantLock admissionLock = new ReentrantLock();
    private final Deque<String> queue = new ArrayDeque<>();
    private volatile int maxConcurrentJobs;
    private final Counter jobsCompletedCounter;
    private final Counter jobsFailedCounter;
    private final Counter jobsCancelledCounter;
    private final Counter filesProcessedCounter;
    private final Counter filesFailedCounter;

    public DefaultBatchProcessingService(
            JobRegistry registry,
            ImageBackend backend,
            AdjustmentPipeline pipeline,
            ExportEncoder exportEncoder,
            PresetResolver presetResolver,
            @Qualifier(BatchExecutorConfig.JOB_EXECUTOR) TaskExecutor jobExecutor,
            PhotoForgeProperties properties,
            MeterRegistry meterRegistry) {
        this.registry = registry;
        this.backend = backend;
        this.pipeline = pipeline;
        this.exportEncoder = exportEncoder;
        this.presetResolver = presetResolver;
        this.jobExecutor = jobExecutor;
        this.maxConcurrentJobs = clampConcurrency(properties.getBatch().getMaxConcurrentJobs());
        this.jobsCompletedCounter = meterRegistry.counter("photo_forge.batch.jobs", "outcome", "completed");
        this.jobsFailedCounter = meterRegistry.counter("photo_forge.batch.jobs", "outcome", "failed");
        this.jobsCancelledCounter = meterRegistry.counter("photo_forge.batch.jobs", "outcome", "cancelled");
        this.filesProcessedCounter = meterRegistry.counter("photo_forge.batch.files", "outcome", "processed");
        this.filesFailedCounter = meterRegistry.counter("photo_forge.batch.files", "outcome", "failed");
    }

    @Override
    public BatchJob createBatchJob(
            String name,
            List<String> inputFiles,
            String outputDirectory,
            AdjustmentSet adjustments,
            ExportOptions exportOptions) {
        if (outputDirectory == null || outputDirectory.isBlank()) {
            throw new IllegalArgumentException("outputDirectory is required.");
        }
        if (exportOptions == null) {
            throw new IllegalArgumentException("exportOptions is required.");
        }
        if (inputFiles != null && inputFiles.stream().anyMatch(file -> file == null || file.isBlank())) {
            throw new IllegalArgumentException("inputFiles must not contain blank entries.");
        }

        Instant now = Instant.now();
        BatchJob job = BatchJob.pending(
                Identifiers.timestamped(JOB_ID_PREFIX, now.toEpochMilli()),
                name,
                now,
                inputFiles,
                outputDirectory,
                adjustments == null ? AdjustmentSet.identity() : adjustments,
                exportOptions);
        registry.register(job);

        logger.info(
                "Created batch job {} name={} files={} format={}",
                job.id(),
                name,
                job.totalFiles(),
                exportOptions.format().apiValue());
        return job;
    }

    @Override
    public Optional<BatchJob> createBatchJobFromPreset(
            String name,
            List<String> inputFiles,
            String outputDirectory,
            String presetId,
            ExportOptions exportOptions) {
        Optional<AdjustmentSet> resolved = presetResolver.resolve(AdjustmentSet.identity(), presetId);
        if (resolved.isEmpty()) {
            logger.warn("Cannot create batch job {} from unknown preset {}", name, presetId);
            return Optional.empty();
        }
        return Optional.of(createBatchJob(name, inputFiles, outputDirectory, resolved.get(), exportOptions));
    }

    @Override
    public boolean queueJob(String jobId) {
        admissionLock.lock();
        try {
            BatchJob job = registry.get(jobId).orElse(null);
            if (job == null) {
                logger.warn("Cannot queue unknown batch job {}", jobId);
                return false;
            }
            if (job.state() != BatchJobState.PENDING) {
                logger.warn("Cannot queue batch job {} in state {}", jobId, job.state());
                return false;
            }
            if (queue.contains(jobId)) {
                logger.warn("Batch job {} is already queued", jobId);
                return false;
            }

            try {
                prepareOutputDirectory(job.outputDirectory());
            } catch (OutputDirectoryException e) {
                registry.transition(
                        jobId,
                        BatchJobState.PENDING,
                        current -> current.failedBeforeStart(e.getMessage(), Instant.now()));
                jobsFailedCounter.increment();
                logger.warn("Batch job {} failed before start: {}", jobId, e.getMessage());
                return false;
            }

            queue.addLast(jobId);
            logger.info("Queued batch job {} queueLength={}", jobId, queue.size());
        } finally {
            admissionLock.unlock();
        }

        admitQueuedJobs();
        return true;
    }

    @Override
    public Optional<BatchJob> getJob(String jobId) {
        return registry.get(jobId);
    }

    @Override
    public List<BatchJob> getAllJobs() {
        return registry.all();
    }

    @Override
    public List<BatchJob> getJobsByStatus(BatchJobState state) {
        return registry.byState(state);
    }

    @Override
    public boolean cancelJob(String jobId) {
        admissionLock.lock();
        try {
            Optional<BatchJob> cancelled = registry.transition(
                    jobId,
                    BatchJobState.PENDING,
                    current -> current.failedBeforeStart(CANCELLED_MESSAGE, Instant.now()));
            if (cancelled.isEmpty()) {
                logger.warn("Cannot cancel batch job {}: unknown or not pending", jobId);
                return false;
            }
            queue.remove(jobId);
        } finally {
            admissionLock.unlock();
        }

        jobsCancelledCounter.increment();
        logger.info("Cancelled batch job {}", jobId);
        return true;
    }

    @Override
    public boolean deleteJob(String jobId) {
        boolean removed = registry.removeIfTerminal(jobId);
        if (removed) {
            logger.info("Deleted batch job {}", jobId);
        } else {
            logger.warn("Cannot delete batch job {}: unknown or not finished", jobId);
        }
        return removed;
    }

    @Override
    public int clearCompletedJobs() {
        int removed = registry.removeAllInState(BatchJobState.COMPLETED);
        logger.info("Cleared {} completed batch job(s)", removed);
        return removed;
    }

    @Override
    public BatchStatistics getStatistics() {
        return BatchStatistics.of(registry.snapshot());
    }

    @Override
    public QueueStatus getQueueStatus() {
        // Unlocked read: only a hint that some thread held the admission lock a moment ago.
        boolean admitting = admissionLock.isLocked();
        int queueLength;
        admissionLock.lock();
        try {
            queueLength = queue.size();
        } finally {
            admissionLock.unlock();
        }
        return new QueueStatus(
                queueLength,
                admitting,
                maxConcurrentJobs,
                (int) registry.countInState(BatchJobState.PROCESSING));
    }

    @Override
    public void setMaxConcurrentJobs(int maxConcurrentJobs) {
        int clamped = clampConcurrency(maxConcurrentJobs);
        this.maxConcurrentJobs = clamped;
        logger.info("Max concurrent batch jobs set to {}", clamped);
        admitQueuedJobs();
    }

    private static void prepareOutputDirectory(String outputDirectory) throws OutputDirectoryException {
        try {
            Files.createDirectories(Path.of(outputDirectory));
        } catch (IOException | InvalidPathException e) {
            throw new OutputDirectoryException(DIRECTORY_FAILURE_PREFIX + e.getMessage(), e);
        }
    }

    private void admitQueuedJobs() {
        List<BatchJob> admitted = new ArrayList<>();
        admissionLock.lock();
        try {
            while (!queue.isEmpty() && registry.countInState(BatchJobState.PROCESSING) < maxConcurrentJobs) {
                String jobId = queue.pollFirst();
                registry.transition(jobId, BatchJobState.PENDING, job -> job.started(Instant.now()))
                        .ifPresent(admitted::add);
            }
        } finally {
            admissionLock.unlock();
        }

        for (BatchJob job : admitted) {
            dispatch(job);
        }
    }

    private void dispatch(BatchJob job) {
        try {
            jobExecutor.execute(() -> runJob(job));
        } catch (RejectedExecutionException e) {
            logger.error("Batch job {} could not be scheduled", job.id(), e);
            registry.transition(
                    job.id(),
                    BatchJobState.PROCESSING,
                    current -> current.failedBeforeStart("Job could not be scheduled: " + e.getMessage(), Instant.now()));
            jobsFailedCounter.increment();
        }
    }

    private void runJob(BatchJob job) {
        logger.info("Starting batch job {} name={} files={}", job.id(), job.name(), job.totalFiles());
        try {
            Path outputDirectory = Path.of(job.outputDirectory());
            for (int index = 0; index < job.totalFiles(); index++) {
                recordOutcome(job.id(), processFile(job, outputDirectory, index));
            }
        } finally {
            recordUnfinishedFiles(job);
            Optional<BatchJob> finished = registry.transition(
                    job.id(),
                    BatchJobState.PROCESSING,
                    current -> current.finished(Instant.now()));
            finished.ifPresent(this::logCompletion);
            admitQueuedJobs();
        }
    }

    /**
     * Records an error for every file that has no outcome yet. Only happens when the file loop is
     * left by an {@link Error}.
     */
    private void recordUnfinishedFiles(BatchJob job) {
        BatchJob current = registry.get(job.id()).orElse(null);
        if (current == null || current.state() != BatchJobState.PROCESSING) {
            return;
        }
        int recorded = current.processedFiles() + current.errors().size();
        if (recorded >= job.totalFiles()) {
            return;
        }
        logger.error(
                "Batch job {} stopped after {} of {} files; marking the rest as failed",
                job.id(),
                recorded,
                job.totalFiles());
        for (int index = recorded; index < job.totalFiles(); index++) {
            recordOutcome(job.id(), job.inputFiles().get(index) + ": " + ABORTED_MESSAGE);
        }
    }

    /**
     * Processes one file and returns {@code null} on success or the error entry on failure.
     */
    private String processFile(BatchJob job, Path outputDirectory, int index) {
        String inputFile = job.inputFiles().get(index);
        try {
            Path input = Path.of(inputFile);
            if (!Files.exists(input)) {
                throw new InputFileMissingException(INPUT_MISSING_MESSAGE);
            }

            Path output = OutputFileNamer.outputPath(outputDirectory, inputFile, index, job.exportOptions());
            if (Files.exists(output) && !job.exportOptions().overwrite()) {
                throw new OutputExistsException(OUTPUT_EXISTS_MESSAGE);
            }

            BufferedImage decoded = backend.decode(input);
            BufferedImage edited = pipeline.apply(decoded, job.adjustments());
            exportEncoder.export(edited, job.exportOptions(), output);
            logger.debug("Batch job {} processed {} -> {}", job.id(), inputFile, output.getFileName());
            return null;
        } catch (IOException | IllegalArgumentException e) {
            String error = fileError(inputFile, e);
            logger.warn("Batch job {} file failed: {}", job.id(), error);
            return error;
        } catch (RuntimeException e) {
            logger.error("Unexpected failure processing {} in batch job {}", inputFile, job.id(), e);
            return fileError(inputFile, e);
        }
    }

    private void recordOutcome(String jobId, String error) {
        if (error == null) {
            registry.update(jobId, BatchJob::withFileProcessed);
            filesProcessedCounter.increment();
        } else {
            registry.update(jobId, job -> job.withFileFailed(error));
            filesFailedCounter.increment();
        }
    }

    private void logCompletion(BatchJob job) {
        if (job.state() == BatchJobState.COMPLETED) {
            jobsCompletedCounter.increment();
        } else {
            jobsFailedCounter.increment();
        }
        logger.info(
                "Finished batch job {} state={} processed={}/{} errors={}",
                job.id(),
                job.state(),
                job.processedFiles(),
                job.totalFiles(),
                job.errors().size());
    }

    private static String fileError(String inputFile, Throwable error) {
        String message = error == null || error.getMessage() == null
                ? "Unknown error"
                : error.getMessage();
        return inputFile + ": " + message;
    }

    private static int clampConcurrency(int requested) {
        return Math.max(
                PhotoForgeProperties.Batch.MIN_CONCURRENT_JOBS,
                Math.min(PhotoForgeProperties.Batch.MAX_CONCURRENT_JOBS, requested));
    }
}
