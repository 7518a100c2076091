package io.tablexform.core.engine;

import io.tablexform.core.engine.columnar.ColumnarTableEngine;
import io.tablexform.core.engine.labeled.LabeledTableEngine;
import io.tablexform.core.spi.TableEngine;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of table engines keyed by engine id. Thread-safe: registration and lookup can happen
 * concurrently.
 */
public final class EngineRegistry {

    private final Map<String, TableEngine<?>> engines = new ConcurrentHashMap<>();

    /** Returns a registry holding the {@code labeled} and {@code columnar} engines. */
    public static EngineRegistry withDefaults() {
        EngineRegistry registry = new EngineRegistry();
        registry.register(new LabeledTableEngine());
        registry.register(new ColumnarTableEngine());
        return registry;
    }

    /**
     * Makes {@code engine} available under its {@link TableEngine#id()}. A later registration
     * with the same id takes its place for pipelines opened afterwards; pipelines already open
     * keep the engine they were bound to.
     *
     * @throws NullPointerException     if {@code engine} is null
     * @throws IllegalArgumentException if the engine reports a null or blank id
     */
    public void register(TableEngine<?> engine) {
        Objects.requireNonNull(engine, "engine must not be null");
        String id = engine.id();
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Table engine " + engine.getClass().getName() + " has no id");
        }
        engines.put(id, engine);
    }

    public Optional<TableEngine<?>> getEngine(String engineId) {
        return Optional.ofNullable(engines.get(engineId));
    }

    /**
     * Looks up an engine by id.
     *
     * @throws IllegalArgumentException if no engine is registered with the given id
     */
    public TableEngine<?> requireEngine(String engineId) {
        return getEngine(engineId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "No table engine registered for id: '" + engineId + "'; available: " + ids()));
    }

    public int size() {
        return engines.size();
    }

    public boolean hasEngine(String engineId) {
        return engines.containsKey(engineId);
    }

    /** Registered ids, sorted. */
    public Set<String> ids() {
        return new TreeSet<>(engines.keySet());
    }
}
