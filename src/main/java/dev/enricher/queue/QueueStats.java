package dev.enricher.queue;

/**
 * Snapshot of the queue.
 *
 * @param oldestPendingAgeMs age of the oldest pending job, 0 when none is pending
 */
public record QueueStats(
        long pending,
        long processing,
        long retrying,
        long completed,
        long failed,
        long oldestPendingAgeMs) {
}
