package github.sarthakdev143.photo_forge.controller;

import github.sarthakdev143.photo_forge.model.AdjustmentSet;
import github.sarthakdev143.photo_forge.model.BatchJob;
import github.sarthakdev143.photo_forge.model.BatchJobState;
import github.sarthakdev143.photo_forge.model.BatchStatistics;
import github.sarthakdev143.photo_forge.model.ExportFormat;
import github.sarthakdev143.photo_forge.model.ExportOptions;
import github.sarthakdev143.photo_forge.model.QueueStatus;
import github.sarthakdev143.photo_forge.service.BatchProcessingService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BatchJobController.class)
class BatchJobControllerTest {

    private static final Instant CREATED_AT = Instant.parse("2026-03-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private BatchProcessingService batchProcessingService;

    @Test
    void createJobReturnsCreatedWithClampedAdjustments() throws Exception {
        when(batchProcessingService.createBatchJob(anyString(), anyList(), anyString(), any(AdjustmentSet.class), any(ExportOptions.class)))
                .thenReturn(pendingJob("batch-1"));

        mockMvc.perform(post("/api/batch/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "name": "Wedding",
                                  "inputFiles": ["/in/a.jpg", "/in/b.jpg"],
                                  "outputDirectory": "/out",
                                  "adjustments": {"exposure": 5, "contrast": -300},
                                  "exportOptions": {"format": "jpg", "quality": 80}
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("batch-1"))
                .andExpect(jsonPath("$.state").value("PENDING"))
                .andExpect(jsonPath("$.exportOptions.format").value("png"));

        ArgumentCaptor<AdjustmentSet> adjustments = ArgumentCaptor.forClass(AdjustmentSet.class);
        ArgumentCaptor<ExportOptions> options = ArgumentCaptor.forClass(ExportOptions.class);
        verify(batchProcessingService).createBatchJob(
                eq("Wedding"), eq(List.of("/in/a.jpg", "/in/b.jpg")), eq("/out"), adjustments.capture(), options.capture());
        assertThat(adjustments.getValue().exposure()).isEqualTo(2.0);
        assertThat(adjustments.getValue().contrast()).isEqualTo(-100.0);
        assertThat(options.getValue().format()).isEqualTo(ExportFormat.JPEG);
        assertThat(options.getValue().quality()).isEqualTo(80);
    }

    @Test
    void createJobRequiresOutputDirectory() throws Exception {
        mockMvc.perform(post("/api/batch/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "x", "inputFiles": [], "exportOptions": {"format": "png"}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid request: outputDirectory is required."));

        verifyNoInteractions(batchProcessingService);
    }

    @Test
    void createJobRejectsUnsupportedFormat() throws Exception {
        mockMvc.perform(post("/api/batch/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "x", "inputFiles": [], "outputDirectory": "/out", "exportOptions": {"format": "gif"}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("Invalid request")));

        verifyNoInteractions(batchProcessingService);
    }

    @Test
    void createJobRejectsMalformedJson() throws Exception {
        mockMvc.perform(post("/api/batch/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid request: malformed JSON body."));
    }

    @Test
    void createJobFromUnknownPresetReturnsNotFound() throws Exception {
        when(batchProcessingService.createBatchJobFromPreset(any(), anyList(), anyString(), eq("nope"), any()))
                .thenReturn(Optional.empty());

        mockMvc.perform(post("/api/batch/jobs/from-preset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "x", "inputFiles": [], "outputDirectory": "/out", "presetId": "nope",
                                 "exportOptions": {"format": "png"}}
                                """))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value(containsString("nope")));
    }

    @Test
    void createJobFromPresetReturnsCreated() throws Exception {
        when(batchProcessingService.createBatchJobFromPreset(any(), anyList(), anyString(), eq("vintage-film"), any()))
                .thenReturn(Optional.of(pendingJob("batch-2")));

        mockMvc.perform(post("/api/batch/jobs/from-preset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "x", "inputFiles": ["/in/a.jpg"], "outputDirectory": "/out",
                                 "presetId": "vintage-film", "exportOptions": {"format": "png"}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("batch-2"));
    }

    @Test
    void queueJobReturnsAccepted() throws Exception {
        when(batchProcessingService.queueJob("batch-1")).thenReturn(true);
        when(batchProcessingService.getJob("batch-1")).thenReturn(Optional.of(pendingJob("batch-1")));

        mockMvc.perform(post("/api/batch/jobs/batch-1/queue"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value("batch-1"));
    }

    @Test
    void queueJobReportsDirectoryFailureAsConflict() throws Exception {
        BatchJob failed = pendingJob("batch-1").failedBeforeStart("Failed to create output directory: denied", CREATED_AT);
        when(batchProcessingService.queueJob("batch-1")).thenReturn(false);
        when(batchProcessingService.getJob("batch-1")).thenReturn(Optional.of(failed));

        mockMvc.perform(post("/api/batch/jobs/batch-1/queue"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message")
                        .value("Batch job batch-1 could not be queued: Failed to create output directory: denied"));
    }

    @Test
    void queueUnknownJobReturnsNotFound() throws Exception {
        when(batchProcessingService.queueJob("missing")).thenReturn(false);
        when(batchProcessingService.getJob("missing")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/batch/jobs/missing/queue"))
                .andExpect(status().isNotFound());
    }

    @Test
    void listJobsFiltersByStatus() throws Exception {
        when(batchProcessingService.getJobsByStatus(BatchJobState.PENDING)).thenReturn(List.of(pendingJob("batch-3")));

        mockMvc.perform(get("/api/batch/jobs").param("status", "pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("batch-3"))
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void listJobsRejectsUnknownStatus() throws Exception {
        mockMvc.perform(get("/api/batch/jobs").param("status", "sleeping"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getUnknownJobReturnsNotFound() throws Exception {
        when(batchProcessingService.getJob("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/batch/jobs/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void cancelProcessingJobReturnsConflict() throws Exception {
        when(batchProcessingService.cancelJob("batch-1")).thenReturn(false);
        when(batchProcessingService.getJob("batch-1"))
                .thenReturn(Optional.of(pendingJob("batch-1").started(CREATED_AT)));

        mockMvc.perform(post("/api/batch/jobs/batch-1/cancel"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value(containsString("PROCESSING")));
    }

    @Test
    void cancelPendingJobReturnsCancelledJob() throws Exception {
        when(batchProcessingService.cancelJob("batch-1")).thenReturn(true);
        when(batchProcessingService.getJob("batch-1"))
                .thenReturn(Optional.of(pendingJob("batch-1").failedBeforeStart("Job cancelled by user", CREATED_AT)));

        mockMvc.perform(post("/api/batch/jobs/batch-1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("FAILED"))
                .andExpect(jsonPath("$.errors[0]").value("Job cancelled by user"));
    }

    @Test
    void deleteFinishedJobReturnsNoContent() throws Exception {
        when(batchProcessingService.deleteJob("batch-1")).thenReturn(true);

        mockMvc.perform(delete("/api/batch/jobs/batch-1"))
                .andExpect(status().isNoContent());
    }

    @Test
    void deletePendingJobReturnsConflict() throws Exception {
        when(batchProcessingService.deleteJob("batch-1")).thenReturn(false);
        when(batchProcessingService.getJob("batch-1")).thenReturn(Optional.of(pendingJob("batch-1")));

        mockMvc.perform(delete("/api/batch/jobs/batch-1"))
                .andExpect(status().isConflict());
    }

    @Test
    void clearCompletedReturnsRemovedCount() throws Exception {
        when(batchProcessingService.clearCompletedJobs()).thenReturn(4);

        mockMvc.perform(delete("/api/batch/jobs/completed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(4));
    }

    @Test
    void statisticsAndQueueStatusAreExposed() throws Exception {
        when(batchProcessingService.getStatistics()).thenReturn(new BatchStatistics(3, 1, 1, 1, 0, 5, 9, 0));
        when(batchProcessingService.getQueueStatus()).thenReturn(new QueueStatus(2, false, 3, 1));

        mockMvc.perform(get("/api/batch/statistics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(3))
                .andExpect(jsonPath("$.totalFilesQueued").value(9));
        mockMvc.perform(get("/api/batch/queue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.queueLength").value(2))
                .andExpect(jsonPath("$.maxConcurrent").value(3));
    }

    @Test
    void setConcurrencyUpdatesService() throws Exception {
        when(batchProcessingService.getQueueStatus()).thenReturn(new QueueStatus(0, false, 5, 0));

        mockMvc.perform(put("/api/batch/concurrency").param("max", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxConcurrent").value(5));

        verify(batchProcessingService).setMaxConcurrentJobs(5);
    }

    @Test
    void setConcurrencyRejectsValuesBelowOne() throws Exception {
        mockMvc.perform(put("/api/batch/concurrency").param("max", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(put("/api/batch/concurrency").param("max", "many"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(batchProcessingService);
    }

    private static BatchJob pendingJob(String id) {
        return BatchJob.pending(
                id,
                "job",
                CREATED_AT,
                List.of("/in/a.jpg"),
                "/out",
                AdjustmentSet.identity(),
                ExportOptions.of(ExportFormat.PNG));
    }
}
