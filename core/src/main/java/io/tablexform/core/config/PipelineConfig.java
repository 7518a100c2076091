package io.tablexform.core.config;

import java.util.Objects;

/**
 * Settings for pipelines opened through {@link io.tablexform.core.engine.PipelineFactory}.
 *
 * <p>
 * Use {@link #builder()} to override individual fields; {@link #DEFAULT} holds the documented
 * defaults.
 *
 * @param engine         id of the engine used when the caller names none
 * @param incremental    whether {@code apply} may start from the cached snapshot; {@code false}
 *                       replays every sequence from the original table
 * @param slowStepWarnMs steps slower than this many milliseconds are logged at WARN
 */
public record PipelineConfig(String engine, boolean incremental, long slowStepWarnMs) {

    /** Default engine id. */
    public static final String DEFAULT_ENGINE = "labeled";

    /** Default slow-step threshold. */
    public static final long DEFAULT_SLOW_STEP_WARN_MS = 1000;

    public static final PipelineConfig DEFAULT = new PipelineConfig(DEFAULT_ENGINE, true, DEFAULT_SLOW_STEP_WARN_MS);

    public PipelineConfig {
        Objects.requireNonNull(engine, "engine must not be null");
        if (engine.isBlank()) {
            throw new IllegalArgumentException("engine must not be blank");
        }
        if (slowStepWarnMs < 0) {
            throw new IllegalArgumentException("slowStepWarnMs must be >= 0, got: " + slowStepWarnMs);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder seeded with this configuration's values. */
    public Builder toBuilder() {
        return new Builder().engine(engine).incremental(incremental).slowStepWarnMs(slowStepWarnMs);
    }

    /** Builder for {@link PipelineConfig}; every field starts at its default. */
    public static final class Builder {

        private String engine = DEFAULT_ENGINE;
        private boolean incremental = true;
        private long slowStepWarnMs = DEFAULT_SLOW_STEP_WARN_MS;

        private Builder() {}

        public Builder engine(String engine) {
            this.engine = engine;
            return this;
        }

        public Builder incremental(boolean incremental) {
            this.incremental = incremental;
            return this;
        }

        public Builder slowStepWarnMs(long slowStepWarnMs) {
            this.slowStepWarnMs = slowStepWarnMs;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(engine, incremental, slowStepWarnMs);
        }
    }
}
