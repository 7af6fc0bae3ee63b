package github.sarthakdev143.photo_forge.controller;

import github.sarthakdev143.photo_forge.dto.ClearedJobsResponse;
import github.sarthakdev143.photo_forge.dto.CreateBatchJobFromPresetRequest;
import github.sarthakdev143.photo_forge.dto.CreateBatchJobRequest;
import github.sarthakdev143.photo_forge.exception.JobNotFoundException;
import github.sarthakdev143.photo_forge.exception.JobStateConflictException;
import github.sarthakdev143.photo_forge.exception.PresetNotFoundException;
import github.sarthakdev143.photo_forge.model.AdjustmentSet;
import github.sarthakdev143.photo_forge.model.BatchJob;
import github.sarthakdev143.photo_forge.model.BatchJobState;
import github.sarthakdev143.photo_forge.service.BatchProcessingService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/batch")
public class BatchJobController {

    private final BatchProcessingService batchProcessingService;

    public BatchJobController(BatchProcessingService batchProcessingService) {
        this.batchProcessingService = batchProcessingService;
    }

    @PostMapping("/jobs")
    public ResponseEntity<?> createJob(@RequestBody CreateBatchJobRequest request) {
        validateTarget(request.inputFiles(), request.outputDirectory());
        if (request.exportOptions() == null) {
            throw new IllegalArgumentException("exportOptions is required.");
        }

        AdjustmentSet adjustments = request.adjustments() == null
                ? AdjustmentSet.identity()
                : request.adjustments().clamped();
        BatchJob job = batchProcessingService.createBatchJob(
                request.name(),
                request.inputFiles(),
                request.outputDirectory(),
                adjustments,
                request.exportOptions());
        return ResponseEntity.status(HttpStatus.CREATED).body(job);
    }

    @PostMapping("/jobs/from-preset")
    public ResponseEntity<?> createJobFromPreset(@RequestBody CreateBatchJobFromPresetRequest request) {
        validateTarget(request.inputFiles(), request.outputDirectory());
        if (request.presetId() == null || request.presetId().isBlank()) {
            throw new IllegalArgumentException("presetId is required.");
        }
        if (request.exportOptions() == null) {
            throw new IllegalArgumentException("exportOptions is required.");
        }

        BatchJob job = batchProcessingService.createBatchJobFromPreset(
                        request.name(),
                        request.inputFiles(),
                        request.outputDirectory(),
                        request.presetId(),
                        request.exportOptions())
                .orElseThrow(() -> new PresetNotFoundException(request.presetId()));
        return ResponseEntity.status(HttpStatus.CREATED).body(job);
    }

    @PostMapping("/jobs/{jobId}/queue")
    public ResponseEntity<?> queueJob(@PathVariable String jobId) {
        if (batchProcessingService.queueJob(jobId)) {
            return ResponseEntity.accepted().body(requireJob(jobId));
        }

        BatchJob job = requireJob(jobId);
        if (job.state() == BatchJobState.FAILED && !job.errors().isEmpty()) {
            throw new JobStateConflictException(
                    "Batch job " + jobId + " could not be queued: " + job.errors().get(job.errors().size() - 1));
        }
        throw new JobStateConflictException("Batch job " + jobId + " cannot be queued in state " + job.state() + ".");
    }

    @GetMapping("/jobs")
    public List<BatchJob> listJobs(@RequestParam(value = "status", required = false) String status) {
        if (status == null || status.isBlank()) {
            return batchProcessingService.getAllJobs();
        }
        return batchProcessingService.getJobsByStatus(BatchJobState.fromInput(status));
    }

    @GetMapping("/jobs/{jobId}")
    public BatchJob getJob(@PathVariable String jobId) {
        return requireJob(jobId);
    }

    @PostMapping("/jobs/{jobId}/cancel")
    public BatchJob cancelJob(@PathVariable String jobId) {
        if (!batchProcessingService.cancelJob(jobId)) {
            BatchJob job = requireJob(jobId);
            throw new JobStateConflictException(
                    "Only pending jobs can be cancelled; batch job " + jobId + " is " + job.state() + ".");
        }
        return requireJob(jobId);
    }

    @DeleteMapping("/jobs/{jobId}")
    public ResponseEntity<Void> deleteJob(@PathVariable String jobId) {
        if (!batchProcessingService.deleteJob(jobId)) {
            BatchJob job = requireJob(jobId);
            throw new JobStateConflictException(
                    "Only completed or failed jobs can be deleted; batch job " + jobId + " is " + job.state() + ".");
        }
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/jobs/completed")
    public ClearedJobsResponse clearCompletedJobs() {
        return new ClearedJobsResponse(batchProcessingService.clearCompletedJobs());
    }

    @GetMapping("/statistics")
    public ResponseEntity<?> getStatistics() {
        return ResponseEntity.ok(batchProcessingService.getStatistics());
    }

    @GetMapping("/queue")
    public ResponseEntity<?> getQueueStatus() {
        return ResponseEntity.ok(batchProcessingService.getQueueStatus());
    }

    @PutMapping("/concurrency")
    public ResponseEntity<?> setMaxConcurrentJobs(@RequestParam("max") int max) {
        if (max < 1) {
            throw new IllegalArgumentException("max must be at least 1.");
        }
        batchProcessingService.setMaxConcurrentJobs(max);
        return ResponseEntity.ok(batchProcessingService.getQueueStatus());
    }

    private BatchJob requireJob(String jobId) {
        return batchProcessingService.getJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private void validateTarget(List<String> inputFiles, String outputDirectory) {
        if (inputFiles == null) {
            throw new IllegalArgumentException("inputFiles is required.");
        }
        if (outputDirectory == null || outputDirectory.isBlank()) {
            throw new IllegalArgumentException("outputDirectory is required.");
        }
    }
}
