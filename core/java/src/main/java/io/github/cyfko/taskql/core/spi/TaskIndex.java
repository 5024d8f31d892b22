package io.github.cyfko.taskql.core.spi;

import io.github.cyfko.taskql.core.model.TaskEntity;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Service Provider Interface of the store that owns task records.
 * <p>
 * The engine reads path sets and point lookups from the index and subscribes to its
 * mutation events. It never writes through this interface. Implementations may mutate
 * their content concurrently; returned sets must therefore be snapshots or unmodifiable
 * views that the engine can iterate safely.
 * </p>
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>{@link #pathsByDate(LocalDate)} keys tasks by the anchor day (UTC calendar day)
 *       of their due and scheduled dates.</li>
 *   <li>{@link #taskAt(String)} completes with an empty optional for unknown paths rather
 *       than failing.</li>
 *   <li>Listeners registered through {@link #subscribe(IndexEventType, IndexListener)}
 *       are called after the mutation is visible to readers.</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface TaskIndex {

    Set<String> allPaths();

    Set<String> pathsByStatus(String status);

    /**
     * @param day anchor day
     * @return paths of tasks whose due or scheduled date falls on {@code day}
     */
    Set<String> pathsByDate(LocalDate day);

    Set<String> overduePaths();

    /**
     * Point lookup of a materialized task.
     *
     * @param path task path
     * @return a future completing with the task, or empty when the path is unknown
     */
    CompletableFuture<Optional<TaskEntity>> taskAt(String path);

    /**
     * Days for which {@link #pathsByDate(LocalDate)} holds at least one path.
     * <p>
     * Indexes that can list their date keys let the engine answer before/after conditions
     * from the index. The default reports the keys as unavailable.
     * </p>
     *
     * @return the indexed days, or empty when the index does not expose them
     */
    default Optional<Set<LocalDate>> indexedDates() {
        return Optional.empty();
    }

    List<String> allStatuses();

    List<String> allPriorities();

    List<String> allContexts();

    List<String> allProjects();

    List<String> allTags();

    /**
     * Registers a listener for one kind of mutation.
     *
     * @param type     event kind
     * @param listener callback
     * @return a handle that removes the listener when closed
     */
    Subscription subscribe(IndexEventType type, IndexListener listener);

    /**
     * Handle of a listener registration.
     */
    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
