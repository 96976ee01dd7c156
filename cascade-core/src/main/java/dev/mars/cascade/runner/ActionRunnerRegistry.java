package dev.mars.cascade.runner;

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
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps runner kind names to factories. Names are case insensitive.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class ActionRunnerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ActionRunnerRegistry.class);

    private final Map<String, ActionRunnerFactory> factories = new ConcurrentHashMap<>();

    /**
     * Registers a kind. A later registration under the same name replaces the earlier one.
     */
    public void register(String kind, ActionRunnerFactory factory) {
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(factory, "Factory cannot be null");
        ActionRunnerFactory previous = factories.put(normalize(kind), factory);
        if (previous != null) {
            logger.warn("Runner kind '{}' re-registered; previous factory replaced", kind);
        } else {
            logger.debug("Registered runner kind: {}", kind);
        }
    }

    /**
     * Registers another name for an already registered kind.
     *
     * @throws IllegalArgumentException if the target kind is unknown
     */
    public void alias(String alias, String kind) {
        ActionRunnerFactory factory = factories.get(normalize(kind));
        if (factory == null) {
            throw new IllegalArgumentException("Cannot alias unknown runner kind: " + kind);
        }
        factories.put(normalize(alias), factory);
        logger.debug("Registered runner alias: {} -> {}", alias, kind);
    }

    public void unregister(String kind) {
        if (kind != null && factories.remove(normalize(kind)) != null) {
            logger.debug("Unregistered runner kind: {}", kind);
        }
    }

    public boolean isRegistered(String kind) {
        return kind != null && factories.containsKey(normalize(kind));
    }

    /**
     * Creates a runner for the kind, wrapped in a {@link GuardedActionRunner}.
     */
    public Optional<ActionRunner> create(String kind) {
        if (kind == null) {
            return Optional.empty();
        }
        ActionRunnerFactory factory = factories.get(normalize(kind));
        if (factory == null) {
            return Optional.empty();
        }
        return Optional.of(new GuardedActionRunner(factory.create()));
    }

    /**
     * Registered names, sorted.
     */
    public Set<String> getKinds() {
        return new TreeSet<>(factories.keySet());
    }

    /**
     * Lets a provider register its kinds.
     */
    public void install(ActionRunnerProvider provider) {
        provider.registerRunners(this);
        logger.info("Installed runner provider: {}", provider.getName());
    }

    private static String normalize(String kind) {
        return kind.trim().toLowerCase(Locale.ROOT);
    }
}
