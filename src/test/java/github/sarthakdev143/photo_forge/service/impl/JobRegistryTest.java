package github.sarthakdev143.photo_forge.service.impl;

import github.sarthakdev143.photo_forge.model.AdjustmentSet;
import github.sarthakdev143.photo_forge.model.BatchJob;
import github.sarthakdev143.photo_forge.model.BatchJobState;
import github.sarthakdev143.photo_forge.model.ExportFormat;
import github.sarthakdev143.photo_forge.model.ExportOptions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobRegistryTest {

    private final JobRegistry registry = new JobRegistry();

    @Test
    void registerRejectsDuplicateIds() {
        registry.register(job("batch-1", 1));

        assertThatThrownBy(() -> registry.register(job("batch-1", 2)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void transitionAppliesOnlyFromExpectedState() {
        registry.register(job("batch-1", 1));

        assertThat(registry.transition("batch-1", BatchJobState.PROCESSING, current -> current.finished(Instant.now())))
                .isEmpty();
        assertThat(registry.transition("batch-1", BatchJobState.PENDING, current -> current.started(Instant.now())))
                .map(BatchJob::state)
                .contains(BatchJobState.PROCESSING);
        assertThat(registry.transition("missing", BatchJobState.PENDING, current -> current)).isEmpty();
    }

    @Test
    void removeIfTerminalLeavesActiveJobs() {
        registry.register(job("batch-1", 1));
        registry.register(job("batch-2", 2));
        registry.transition("batch-2", BatchJobState.PENDING, current -> current.failedBeforeStart("x", Instant.now()));

        assertThat(registry.removeIfTerminal("batch-1")).isFalse();
        assertThat(registry.removeIfTerminal("batch-2")).isTrue();
        assertThat(registry.all()).extracting(BatchJob::id).containsExactly("batch-1");
    }

    @Test
    void listingsAreNewestFirst() {
        registry.register(job("old", 1));
        registry.register(job("new", 3));
        registry.register(job("middle", 2));

        assertThat(registry.all()).extracting(BatchJob::id).containsExactly("new", "middle", "old");
        assertThat(registry.byState(BatchJobState.PENDING)).hasSize(3);
        assertThat(registry.countInState(BatchJobState.PENDING)).isEqualTo(3);
    }

    @Test
    void removeAllInStateCountsRemovedJobs() {
        registry.register(job("a", 1));
        registry.register(job("b", 2));
        registry.register(job("c", 3));
        registry.transition("a", BatchJobState.PENDING, current -> current.started(Instant.now()).finished(Instant.now()));
        registry.transition("b", BatchJobState.PENDING, current -> current.started(Instant.now()).finished(Instant.now()));

        assertThat(registry.removeAllInState(BatchJobState.COMPLETED)).isEqualTo(2);
        assertThat(registry.snapshot()).extracting(BatchJob::id).containsExactly("c");
    }

    private static BatchJob job(String id, long createdSecond) {
        return BatchJob.pending(
                id,
                id,
                Instant.ofEpochSecond(createdSecond),
                List.of("a.png"),
                "/out",
                AdjustmentSet.identity(),
                ExportOptions.of(ExportFormat.PNG));
    }
}
