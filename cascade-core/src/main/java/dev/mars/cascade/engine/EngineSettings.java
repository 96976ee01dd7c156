package dev.mars.cascade.engine;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.cascade.outcome.RenderingMode;
import dev.mars.cascade.strategy.FreeStrategy;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable engine configuration, fixed for the engine's lifetime.
 */
public final class EngineSettings {

    public static final Duration DEFAULT_CANCEL_GRACE_PERIOD = Duration.ofSeconds(5);

    private final String strategyName;
    private final int concurrencyLimit;
    private final RenderingMode renderingMode;
    private final boolean enforceDeclaredOutcomes;
    private final Duration cancelGracePeriod;

    private EngineSettings(Builder builder) {
        this.strategyName = Objects.requireNonNull(builder.strategyName, "Strategy name cannot be null");
        if (builder.concurrencyLimit < 0) {
            throw new IllegalArgumentException("Concurrency limit cannot be negative: " + builder.concurrencyLimit);
        }
        this.concurrencyLimit = builder.concurrencyLimit;
        this.renderingMode = Objects.requireNonNull(builder.renderingMode, "Rendering mode cannot be null");
        this.enforceDeclaredOutcomes = builder.enforceDeclaredOutcomes;
        Objects.requireNonNull(builder.cancelGracePeriod, "Cancel grace period cannot be null");
        if (builder.cancelGracePeriod.isNegative()) {
            throw new IllegalArgumentException("Cancel grace period cannot be negative");
        }
        this.cancelGracePeriod = builder.cancelGracePeriod;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EngineSettings defaults() {
        return builder().build();
    }

    public String getStrategyName() {
        return strategyName;
    }

    /**
     * Maximum concurrently running actions; 0 means unbounded.
     */
    public int getConcurrencyLimit() {
        return concurrencyLimit;
    }

    public RenderingMode getRenderingMode() {
        return renderingMode;
    }

    /**
     * When true, a successful action whose outcomes differ from its declared outcome keys
     * is recorded as a failure.
     */
    public boolean isEnforceDeclaredOutcomes() {
        return enforceDeclaredOutcomes;
    }

    /**
     * How long in-flight runners get to stop after cancellation before they are interrupted.
     */
    public Duration getCancelGracePeriod() {
        return cancelGracePeriod;
    }

    public Builder toBuilder() {
        return new Builder()
                .strategy(strategyName)
                .concurrencyLimit(concurrencyLimit)
                .renderingMode(renderingMode)
                .enforceDeclaredOutcomes(enforceDeclaredOutcomes)
                .cancelGracePeriod(cancelGracePeriod);
    }

    @Override
    public String toString() {
        return "EngineSettings{" +
                "strategy='" + strategyName + '\'' +
                ", concurrencyLimit=" + concurrencyLimit +
                ", renderingMode=" + renderingMode +
                ", enforceDeclaredOutcomes=" + enforceDeclaredOutcomes +
                ", cancelGracePeriod=" + cancelGracePeriod +
                '}';
    }

    public static final class Builder {
        private String strategyName = FreeStrategy.NAME;
        private int concurrencyLimit = 0;
        private RenderingMode renderingMode = RenderingMode.LENIENT;
        private boolean enforceDeclaredOutcomes = false;
        private Duration cancelGracePeriod = DEFAULT_CANCEL_GRACE_PERIOD;

        private Builder() {
        }

        public Builder strategy(String strategyName) {
            this.strategyName = strategyName;
            return this;
        }

        public Builder concurrencyLimit(int concurrencyLimit) {
            this.concurrencyLimit = concurrencyLimit;
            return this;
        }

        public Builder renderingMode(RenderingMode renderingMode) {
            this.renderingMode = renderingMode;
            return this;
        }

        public Builder enforceDeclaredOutcomes(boolean enforceDeclaredOutcomes) {
            this.enforceDeclaredOutcomes = enforceDeclaredOutcomes;
            return this;
        }

        public Builder cancelGracePeriod(Duration cancelGracePeriod) {
            this.cancelGracePeriod = cancelGracePeriod;
            return this;
        }

        public EngineSettings build() {
            return new EngineSettings(this);
        }
    }
}
