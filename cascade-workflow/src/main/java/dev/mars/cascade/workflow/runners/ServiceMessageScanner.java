package dev.mars.cascade.workflow.runners;

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

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Filters a process's stdout, lifting service messages of the form
 * {@code ##cascade[yield-outcome-b64 <base64 key> <base64 value>]##} out of the visible
 * output and into an outcome map. Any text before the marker on the same line is passed through.
 *
 * <p>One scanner per process; lines must be fed from a single thread.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-25
 * @version 1.0
 */
public class ServiceMessageScanner implements Consumer<String> {

    private static final Logger logger = LoggerFactory.getLogger(ServiceMessageScanner.class);

    static final Pattern SERVICE_MESSAGE = Pattern.compile("^(.*?)##cascade\\[([A-Za-z0-9+/=\\- ]+)]##$");
    static final String YIELD_OUTCOME = "yield-outcome-b64";

    private final String actionId;
    private final Consumer<String> output;
    private final Map<String, String> outcomes = new LinkedHashMap<>();

    public ServiceMessageScanner(String actionId, Consumer<String> output) {
        this.actionId = actionId;
        this.output = output;
    }

    @Override
    public void accept(String line) {
        Matcher matcher = SERVICE_MESSAGE.matcher(line);
        if (!matcher.matches()) {
            output.accept(line);
            return;
        }
        String preceding = matcher.group(1);
        if (!preceding.isEmpty()) {
            output.accept(preceding);
        }
        handle(matcher.group(2).trim());
    }

    /**
     * Outcomes yielded so far; a key yielded twice keeps the last value.
     */
    public Map<String, String> getOutcomes() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    private void handle(String body) {
        String[] parts = body.split(" +");
        if (!YIELD_OUTCOME.equals(parts[0])) {
            logger.warn("Action '{}': unrecognized service message: {}", actionId, parts[0]);
            return;
        }
        if (parts.length < 2 || parts.length > 3) {
            logger.warn("Action '{}': malformed {} message ({} argument(s))", actionId, YIELD_OUTCOME, parts.length - 1);
            return;
        }
        String key;
        String value;
        try {
            key = decode(parts[1]);
            value = parts.length == 3 ? decode(parts[2]) : "";
        } catch (IllegalArgumentException e) {
            logger.warn("Action '{}': failed to decode {} message: {}", actionId, YIELD_OUTCOME, e.getMessage());
            return;
        }
        if (key.isEmpty()) {
            logger.warn("Action '{}': {} message with an empty key", actionId, YIELD_OUTCOME);
            return;
        }
        String previous = outcomes.put(key, value);
        if (previous != null) {
            logger.debug("Action '{}': outcome '{}' yielded again; keeping the last value", actionId, key);
        }
    }

    private static String decode(String encoded) {
        return new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
    }
}
