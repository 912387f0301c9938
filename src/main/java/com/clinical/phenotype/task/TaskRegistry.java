package com.clinical.phenotype.task;

import com.clinical.phenotype.core.model.SourcePosition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Dispatch table from (catalog, task name) to {@link TaskExecutor}.
 * A catalog is the library name a script includes, e.g. {@code include ClarityCore called Clarity;}
 * makes {@code Clarity.TermFinder} resolve to catalog {@code ClarityCore}, task {@code TermFinder}.
 *
 * <p>Populated once through {@link #builder()} and read-only afterwards, so it can be shared
 * by every run and worker thread without synchronization.</p>
 */
public final class TaskRegistry {

    private final Map<String, Map<String, TaskExecutor>> catalogs;

    private TaskRegistry(Builder builder) {
        Map<String, Map<String, TaskExecutor>> copy = new LinkedHashMap<>();
        builder.catalogs.forEach((catalog, tasks) ->
                copy.put(catalog, Collections.unmodifiableMap(new LinkedHashMap<>(tasks))));
        this.catalogs = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasCatalog(String catalog) {
        return catalogs.containsKey(catalog);
    }

    public Set<String> catalogNames() {
        return catalogs.keySet();
    }

    public Set<String> taskNames(String catalog) {
        return catalogs.getOrDefault(catalog, Map.of()).keySet();
    }

    public Optional<TaskExecutor> find(String catalog, String taskName) {
        return Optional.ofNullable(catalogs.getOrDefault(catalog, Map.of()).get(taskName));
    }

    /**
     * Looks up an executor, failing with {@link UnknownTaskException} at the given script position.
     */
    public TaskExecutor require(String catalog, String taskName, SourcePosition position) {
        return find(catalog, taskName)
                .orElseThrow(() -> new UnknownTaskException(catalog + "." + taskName, position));
    }

    public static class Builder {
        private final Map<String, Map<String, TaskExecutor>> catalogs = new LinkedHashMap<>();

        /**
         * Registers an executor under a catalog. Registering the same name twice is an error.
         */
        public Builder register(String catalog, TaskExecutor executor) {
            if (catalog == null || catalog.isBlank()) {
                throw new IllegalArgumentException("catalog must not be blank");
            }
            Map<String, TaskExecutor> tasks = catalogs.computeIfAbsent(catalog, k -> new LinkedHashMap<>());
            if (tasks.putIfAbsent(executor.getName(), executor) != null) {
                throw new IllegalArgumentException(
                        "Task already registered: " + catalog + "." + executor.getName());
            }
            return this;
        }

        /**
         * Declares a catalog without tasks, so scripts may include it.
         */
        public Builder catalog(String catalog) {
            catalogs.computeIfAbsent(catalog, k -> new LinkedHashMap<>());
            return this;
        }

        public TaskRegistry build() {
            return new TaskRegistry(this);
        }
    }
}
