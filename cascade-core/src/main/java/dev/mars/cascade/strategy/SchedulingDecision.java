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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one scheduling round. Ready actions that appear in neither list are deferred
 * and offered again in the next round.
 */
public final class SchedulingDecision {

    private static final SchedulingDecision DEFER_ALL = new SchedulingDecision(List.of(), Map.of());

    private final List<String> dispatch;
    private final Map<String, String> skip;

    private SchedulingDecision(List<String> dispatch, Map<String, String> skip) {
        this.dispatch = dispatch;
        this.skip = skip;
    }

    public static SchedulingDecision deferAll() {
        return DEFER_ALL;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Actions to start now, in order. A concurrency permit has been taken for each.
     */
    public List<String> getDispatch() {
        return dispatch;
    }

    /**
     * Actions to skip, with the reason recorded as their cause.
     */
    public Map<String, String> getSkip() {
        return skip;
    }

    @Override
    public String toString() {
        return "SchedulingDecision{dispatch=" + dispatch + ", skip=" + skip.keySet() + '}';
    }

    public static final class Builder {
        private final List<String> dispatch = new ArrayList<>();
        private final Map<String, String> skip = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder dispatch(String actionId) {
            dispatch.add(actionId);
            return this;
        }

        public Builder skip(String actionId, String reason) {
            skip.put(actionId, reason);
            return this;
        }

        public SchedulingDecision build() {
            if (dispatch.isEmpty() && skip.isEmpty()) {
                return DEFER_ALL;
            }
            return new SchedulingDecision(List.copyOf(dispatch),
                    Collections.unmodifiableMap(new LinkedHashMap<>(skip)));
        }
    }
}
