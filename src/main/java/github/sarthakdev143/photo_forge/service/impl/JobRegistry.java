package github.sarthakdev143.photo_forge.service.impl;

import github.sarthakdev143.photo_forge.model.BatchJob;
import github.sarthakdev143.photo_forge.model.BatchJobState;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * Owns every {@link BatchJob} record. Updates are applied atomically per job; readers always see a
 * complete snapshot.
 */
@Component
public class JobRegistry {

    private static final Comparator<BatchJob> NEWEST_FIRST =
            Comparator.comparing(BatchJob::createdAt).reversed();

    private final Map<String, BatchJob> jobs = new ConcurrentHashMap<>();

    public void register(BatchJob job) {
        if (jobs.putIfAbsent(job.id(), job) != null) {
            throw new IllegalStateException("Duplicate job id " + job.id());
        }
    }

    public Optional<BatchJob> get(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.get(jobId));
    }

    public List<BatchJob> all() {
        return jobs.values().stream().sorted(NEWEST_FIRST).toList();
    }

    public List<BatchJob> byState(BatchJobState state) {
        return jobs.values().stream()
                .filter(job -> job.state() == state)
                .sorted(NEWEST_FIRST)
                .toList();
    }

    public long countInState(BatchJobState state) {
        return jobs.values().stream().filter(job -> job.state() == state).count();
    }

    /**
     * Applies {@code change} to the job if it exists.
     */
    public Optional<BatchJob> update(String jobId, UnaryOperator<BatchJob> change) {
        return Optional.ofNullable(jobs.computeIfPresent(jobId, (ignored, current) -> change.apply(current)));
    }

    /**
     * Applies {@code change} only while the job is in {@code expectedState}; returns the new record
     * when the transition happened.
     */
    public Optional<BatchJob> transition(String jobId, BatchJobState expectedState, UnaryOperator<BatchJob> change) {
        AtomicBoolean applied = new AtomicBoolean(false);
        BatchJob result = jobs.computeIfPresent(jobId, (ignored, current) -> {
            if (current.state() != expectedState) {
                return current;
            }
            applied.set(true);
            return change.apply(current);
        });
        return applied.get() ? Optional.of(result) : Optional.empty();
    }

    /**
     * Removes the job only if it is terminal.
     */
    public boolean removeIfTerminal(String jobId) {
        AtomicBoolean removed = new AtomicBoolean(false);
        jobs.computeIfPresent(jobId, (ignored, current) -> {
            if (!current.isTerminal()) {
                return current;
            }
            removed.set(true);
            return null;
        });
        return removed.get();
    }

    public int removeAllInState(BatchJobState state) {
        int removed = 0;
        for (String jobId : List.copyOf(jobs.keySet())) {
            AtomicBoolean matched = new AtomicBoolean(false);
            jobs.computeIfPresent(jobId, (ignored, current) -> {
                if (current.state() != state) {
                    return current;
                }
                matched.set(true);
                return null;
            });
            if (matched.get()) {
                removed++;
            }
        }
        return removed;
    }

    public List<BatchJob> snapshot() {
        return List.copyOf(jobs.values());
    }
}
