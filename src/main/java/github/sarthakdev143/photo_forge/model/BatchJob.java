package github.sarthakdev143.photo_forge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable snapshot of one batch job. Every state change produces a new record.
 */
public record BatchJob(
        String id,
        String name,
        Instant createdAt,
        List<String> inputFiles,
        String outputDirectory,
        AdjustmentSet adjustments,
        ExportOptions exportOptions,
        BatchJobState state,
        int progress,
        int processedFiles,
        int totalFiles,
        List<String> errors,
        Instant startedAt,
        Instant completedAt) {

    public BatchJob {
        inputFiles = inputFiles == null ? List.of() : List.copyOf(inputFiles);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static BatchJob pending(
            String id,
            String name,
            Instant createdAt,
            List<String> inputFiles,
            String outputDirectory,
            AdjustmentSet adjustments,
            ExportOptions exportOptions) {
        List<String> files = inputFiles == null ? List.of() : List.copyOf(inputFiles);
        return new BatchJob(
                id,
                name,
                createdAt,
                files,
                outputDirectory,
                adjustments,
                exportOptions,
                BatchJobState.PENDING,
                0,
                0,
                files.size(),
                List.of(),
                null,
                null);
    }

    public BatchJob started(Instant now) {
        return new BatchJob(
                id, name, createdAt, inputFiles, outputDirectory, adjustments, exportOptions,
                BatchJobState.PROCESSING, 0, 0, totalFiles, List.of(), now, null);
    }

    public BatchJob withFileProcessed() {
        return withFileOutcome(processedFiles + 1, errors);
    }

    public BatchJob withFileFailed(String error) {
        List<String> updatedErrors = new ArrayList<>(errors);
        updatedErrors.add(error);
        return withFileOutcome(processedFiles, updatedErrors);
    }

    public BatchJob finished(Instant now) {
        BatchJobState finalState = errors.isEmpty() ? BatchJobState.COMPLETED : BatchJobState.FAILED;
        return new BatchJob(
                id, name, createdAt, inputFiles, outputDirectory, adjustments, exportOptions,
                finalState, 100, processedFiles, totalFiles, errors, startedAt, now);
    }

    /**
     * Fails a job that never started executing, e.g. on cancellation.
     */
    public BatchJob failedBeforeStart(String error, Instant now) {
        List<String> updatedErrors = new ArrayList<>(errors);
        updatedErrors.add(error);
        return new BatchJob(
                id, name, createdAt, inputFiles, outputDirectory, adjustments, exportOptions,
                BatchJobState.FAILED, progress, processedFiles, totalFiles, updatedErrors, startedAt, now);
    }

    @JsonIgnore
    public int attemptedFiles() {
        return processedFiles + errors.size();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return state.isTerminal();
    }

    private BatchJob withFileOutcome(int processed, List<String> updatedErrors) {
        int attempted = processed + updatedErrors.size();
        int updatedProgress = totalFiles == 0 ? 100 : (int) Math.round(attempted * 100.0 / totalFiles);
        return new BatchJob(
                id, name, createdAt, inputFiles, outputDirectory, adjustments, exportOptions,
                state, updatedProgress, processed, totalFiles, updatedErrors, startedAt, completedAt);
    }
}
