package io.github.cyfko.taskql.core.impl;

import io.github.cyfko.taskql.core.model.TaskEntity;
import io.github.cyfko.taskql.core.spi.TaskIndex;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns candidate paths into task snapshots through the index point lookup.
 * <p>
 * Paths are copied first, then looked up in chunks of {@code batchSize}; each chunk is
 * awaited before the next one starts, which bounds the number of lookups in flight.
 * Unknown paths and failed lookups are skipped, failures being logged.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TaskMaterializer {

    private static final Logger log = Logger.getLogger(TaskMaterializer.class.getName());

    private final TaskIndex index;
    private final int batchSize;

    public TaskMaterializer(TaskIndex index, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got: " + batchSize);
        }
        this.index = Objects.requireNonNull(index, "index");
        this.batchSize = batchSize;
    }

    /**
     * @param paths candidate paths
     * @return the tasks found, in path order
     */
    public List<TaskEntity> materialize(Collection<String> paths) {
        List<String> snapshot = new ArrayList<>(paths);
        List<TaskEntity> tasks = new ArrayList<>(snapshot.size());

        for (int start = 0; start < snapshot.size(); start += batchSize) {
            List<String> chunk = snapshot.subList(start, Math.min(start + batchSize, snapshot.size()));
            List<CompletableFuture<Optional<TaskEntity>>> lookups = new ArrayList<>(chunk.size());
            for (String path : chunk) {
                lookups.add(lookup(path));
            }
            CompletableFuture.allOf(lookups.toArray(new CompletableFuture[0])).join();
            for (CompletableFuture<Optional<TaskEntity>> lookup : lookups) {
                lookup.join().ifPresent(tasks::add);
            }
        }

        int requested = snapshot.size();
        log.fine(() -> String.format("Materialized %d of %d candidate paths", tasks.size(), requested));
        return tasks;
    }

    private CompletableFuture<Optional<TaskEntity>> lookup(String path) {
        CompletableFuture<Optional<TaskEntity>> future;
        try {
            future = index.taskAt(path);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return future.handle((task, error) -> {
            if (error != null) {
                log.log(Level.WARNING, error, () -> String.format("Lookup of '%s' failed, task skipped", path));
                return Optional.<TaskEntity>empty();
            }
            return task == null ? Optional.<TaskEntity>empty() : task;
        });
    }
}
