package github.sarthakdev143.photo_forge.model;

/**
 * Scheduler snapshot. {@code admitting} is read without taking the admission lock and is only a hint
 * that admission was running when the status was taken.
 */
public record QueueStatus(int queueLength, boolean admitting, int maxConcurrent, int activeJobs) {
}
