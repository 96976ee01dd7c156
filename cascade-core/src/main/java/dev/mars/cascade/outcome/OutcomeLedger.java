package dev.mars.cascade.outcome;

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

import dev.mars.cascade.core.exceptions.OutcomeConflictException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Write-once store of the outcomes produced during a run, keyed by action id and outcome key.
 *
 * <p>Each action's outcomes are published as one immutable map, so a reader sees either none
 * or all of the keys written by a single {@link #record} call. Reads never block.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class OutcomeLedger {

    private final ConcurrentHashMap<String, Map<String, String>> outcomes = new ConcurrentHashMap<>();

    /**
     * Records a single outcome.
     *
     * @throws OutcomeConflictException if the key was already recorded for this action
     */
    public void put(String actionId, String key, String value) throws OutcomeConflictException {
        record(actionId, Map.of(key, value));
    }

    /**
     * Atomically records a set of outcomes for one action. Nothing is written if any key
     * conflicts with an earlier write.
     *
     * @throws OutcomeConflictException on the first conflicting key
     */
    public void record(String actionId, Map<String, String> values) throws OutcomeConflictException {
        Objects.requireNonNull(actionId, "Action id cannot be null");
        Objects.requireNonNull(values, "Outcomes cannot be null");
        values.forEach((key, value) -> {
            Objects.requireNonNull(key, "Outcome key cannot be null");
            Objects.requireNonNull(value, "Outcome '" + key + "' of '" + actionId + "' cannot be null");
        });
        if (values.isEmpty()) {
            return;
        }

        String[] conflict = new String[1];
        outcomes.compute(actionId, (id, existing) -> {
            Map<String, String> merged = new LinkedHashMap<>();
            if (existing != null) {
                for (String key : values.keySet()) {
                    if (existing.containsKey(key)) {
                        conflict[0] = key;
                        return existing;
                    }
                }
                merged.putAll(existing);
            }
            merged.putAll(values);
            return Collections.unmodifiableMap(merged);
        });
        if (conflict[0] != null) {
            throw new OutcomeConflictException(actionId, conflict[0]);
        }
    }

    public Optional<String> get(String actionId, String key) {
        Map<String, String> values = outcomes.get(actionId);
        return values == null ? Optional.empty() : Optional.ofNullable(values.get(key));
    }

    /**
     * All outcomes recorded for an action; empty when it produced none.
     */
    public Map<String, String> getOutcomes(String actionId) {
        return outcomes.getOrDefault(actionId, Map.of());
    }

    /**
     * Immutable copy of the whole ledger.
     */
    public Map<String, Map<String, String>> snapshot() {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>(outcomes);
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return "OutcomeLedger{actions=" + outcomes.keySet() + '}';
    }
}
