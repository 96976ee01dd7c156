package dev.mars.cascade.strategy;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Named execution strategies. Comes with {@code free}, {@code strict}, {@code sequential}
 * and {@code loose}; further strategies can be registered under new names.
 */
public class StrategyRegistry {

    private static final Logger logger = LoggerFactory.getLogger(StrategyRegistry.class);

    private final Map<String, Supplier<ExecutionStrategy>> strategies = new ConcurrentHashMap<>();

    public StrategyRegistry() {
        register(FreeStrategy.NAME, FreeStrategy::new);
        register(StrictStrategy.NAME, StrictStrategy::new);
        register(SequentialStrategy.NAME, SequentialStrategy::new);
        register(LooseStrategy.NAME, LooseStrategy::new);
    }

    /**
     * @throws IllegalArgumentException if the name is already taken
     */
    public void register(String name, Supplier<ExecutionStrategy> factory) {
        Objects.requireNonNull(factory, "Strategy factory cannot be null");
        String key = normalize(name);
        if (strategies.putIfAbsent(key, factory) != null) {
            throw new IllegalArgumentException("Strategy already registered: " + name);
        }
        logger.debug("Registered execution strategy: {}", key);
    }

    /**
     * Creates a fresh instance of the named strategy.
     *
     * @throws IllegalArgumentException if no strategy has that name
     */
    public ExecutionStrategy create(String name) {
        Supplier<ExecutionStrategy> factory = strategies.get(normalize(name));
        if (factory == null) {
            throw new IllegalArgumentException("Unknown execution strategy: '" + name
                    + "'. Available: " + getNames());
        }
        return factory.get();
    }

    public boolean isRegistered(String name) {
        return name != null && strategies.containsKey(normalize(name));
    }

    public Set<String> getNames() {
        return new TreeSet<>(strategies.keySet());
    }

    private static String normalize(String name) {
        Objects.requireNonNull(name, "Strategy name cannot be null");
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
