package io.tablexform.core.engine;

import io.tablexform.core.config.PipelineConfig;
import io.tablexform.core.model.ColumnData;
import io.tablexform.core.model.Table;
import io.tablexform.core.spi.PipelineListener;
import io.tablexform.core.spi.TableEngine;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens {@link TransformPipeline}s. The engine is chosen once, when the pipeline is opened,
 * either by explicit id or from {@link PipelineConfig#engine()}.
 */
public final class PipelineFactory {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineFactory.class);

    private final EngineRegistry registry;
    private final PipelineConfig config;
    private final PipelineListener listener;

    /** Factory over the built-in engines with default configuration. */
    public PipelineFactory() {
        this(EngineRegistry.withDefaults(), PipelineConfig.DEFAULT, null);
    }

    public PipelineFactory(EngineRegistry registry, PipelineConfig config) {
        this(registry, config, null);
    }

    /**
     * @param registry engines available to {@link #open(String, String, List)}
     * @param config   settings passed to every pipeline
     * @param listener observability hook passed to every pipeline, or {@code null}
     */
    public PipelineFactory(EngineRegistry registry, PipelineConfig config, PipelineListener listener) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.listener = listener;
    }

    /** Opens a pipeline with a generated id on the configured default engine. */
    public TransformPipeline<?> open(List<ColumnData> columns) {
        return open(UUID.randomUUID().toString(), config.engine(), columns);
    }

    /**
     * Opens a pipeline on the engine registered under {@code engineId}.
     *
     * @throws IllegalArgumentException if no engine has that id, or the columns do not form a
     *                                  table
     */
    public TransformPipeline<?> open(String pipelineId, String engineId, List<ColumnData> columns) {
        return open(pipelineId, registry.requireEngine(engineId), columns);
    }

    /** Opens a pipeline on a specific engine instance, keeping its frame type. */
    public <T extends Table> TransformPipeline<T> open(String pipelineId, TableEngine<T> engine, List<ColumnData> columns) {
        Objects.requireNonNull(columns, "columns must not be null");
        T original = engine.load(columns);
        LOG.info(
                "pipeline.open pipeline_id={} engine={} rows={} columns={} incremental={}",
                pipelineId,
                engine.id(),
                original.rowCount(),
                original.columnCount(),
                config.incremental());
        return new TransformPipeline<>(pipelineId, engine, original, config, listener);
    }

    public EngineRegistry registry() {
        return registry;
    }

    public PipelineConfig config() {
        return config;
    }
}
