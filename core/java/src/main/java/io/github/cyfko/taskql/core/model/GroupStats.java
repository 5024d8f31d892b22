package io.github.cyfko.taskql.core.model;

/**
 * Completion counters of one bucket.
 *
 * @param completed number of completed tasks
 * @param total     number of tasks
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record GroupStats(int completed, int total) {

    public GroupStats {
        if (completed < 0 || total < 0 || completed > total) {
            throw new IllegalArgumentException("Invalid counters: completed=" + completed + ", total=" + total);
        }
    }

    /**
     * @return completion rounded to the nearest whole percent, {@code 0} for an empty bucket
     */
    public int percentage() {
        return total == 0 ? 0 : (int) Math.round(completed * 100.0 / total);
    }
}
