package com.clinical.phenotype.task.builtin;

import com.clinical.phenotype.task.TaskRegistry;

/**
 * The reference NLP tasks shipped with the engine.
 */
public final class BuiltinTasks {

    /**
     * Catalog name the command line registers the built-in tasks under.
     */
    public static final String CATALOG = "ClarityCore";

    private BuiltinTasks() {
    }

    public static TaskRegistry.Builder registerAll(TaskRegistry.Builder builder, String catalog) {
        return builder
                .register(catalog, new TermFinderTask())
                .register(catalog, new ValueExtractionTask());
    }

    public static TaskRegistry registry() {
        return registerAll(TaskRegistry.builder(), CATALOG).build();
    }
}
