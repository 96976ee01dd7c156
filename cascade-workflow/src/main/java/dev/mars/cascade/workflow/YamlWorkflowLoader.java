package dev.mars.cascade.workflow;

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

import dev.mars.cascade.core.ActionDescriptor;
import dev.mars.cascade.core.ActionSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * YAML implementation of {@link WorkflowLoader}, using SnakeYAML's safe constructor.
 *
 * <p>Document layout:</p>
 * <pre>
 * context:            # mapping, or a list of mappings merged in order
 *   region: eu
 * actions:
 *   - type: shell     # runner kind, required
 *     name: build     # optional, defaults to &lt;type&gt;-&lt;n&gt;
 *     description: ...
 *     expects: lint   # dependency id, or a list of ids / {name, strict, external} mappings
 *     severity: low   # low or normal (default); a low-severity failure is a warning
 *     outcomes: [version]
 *     command: make   # any other key is a runner parameter
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-24
 * @version 1.0
 */
public class YamlWorkflowLoader implements WorkflowLoader {

    private static final Logger logger = LoggerFactory.getLogger(YamlWorkflowLoader.class);

    static final Set<String> ROOT_KEYS = Set.of("actions", "context");

    static final String TYPE = "type";
    static final String NAME = "name";
    static final String DESCRIPTION = "description";
    static final String EXPECTS = "expects";
    static final String OUTCOMES = "outcomes";
    static final String SEVERITY = "severity";

    static final String STRICT = "strict";
    static final String EXTERNAL = "external";
    static final Set<String> DEPENDENCY_KEYS = Set.of(NAME, STRICT, EXTERNAL);

    private final Yaml yaml;

    public YamlWorkflowLoader() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
    }

    @Override
    public WorkflowDefinition load(Path file) throws WorkflowLoadException {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return loadFromString(content, file.toString());
        } catch (IOException e) {
            throw new WorkflowLoadException(file.toString(), "Failed to read workflow file", e);
        }
    }

    @Override
    public WorkflowDefinition load(InputStream input, String sourceName) throws WorkflowLoadException {
        try {
            String content = new String(input.readAllBytes(), StandardCharsets.UTF_8);
            return loadFromString(content, sourceName);
        } catch (IOException e) {
            throw new WorkflowLoadException(sourceName, "Failed to read workflow source", e);
        }
    }

    @Override
    public WorkflowDefinition loadFromString(String content, String sourceName) throws WorkflowLoadException {
        Object root;
        try {
            root = yaml.load(content);
        } catch (MarkedYAMLException e) {
            Mark mark = e.getProblemMark();
            int line = mark != null ? mark.getLine() + 1 : -1;
            throw new WorkflowLoadException(sourceName, line, null, "YAML parsing failed: " + e.getProblem(), e);
        } catch (YAMLException e) {
            throw new WorkflowLoadException(sourceName, "YAML parsing failed: " + e.getMessage(), e);
        }

        WorkflowDefinition definition = new Parse(sourceName).workflow(root);
        logger.debug("Loaded {} action(s) and {} context key(s) from {}",
                definition.getActions().size(), definition.getContext().size(), sourceName);
        return definition;
    }

    /**
     * State of one document being parsed.
     */
    private static final class Parse {

        private final String source;
        private final Map<String, Integer> nameCounters = new HashMap<>();
        private final Set<String> names = new LinkedHashSet<>();

        Parse(String source) {
            this.source = source;
        }

        WorkflowDefinition workflow(Object root) throws WorkflowLoadException {
            if (!(root instanceof Map)) {
                throw error(null, "Unknown workflow structure: " + typeName(root) + " (should be a mapping)");
            }
            Map<?, ?> rootMap = (Map<?, ?>) root;
            if (rootMap.isEmpty()) {
                throw error(null, "Empty root mapping (expected some of: " + String.join(", ", new TreeSet<>(ROOT_KEYS)) + ")");
            }
            Set<String> unrecognized = new TreeSet<>();
            for (Object key : rootMap.keySet()) {
                if (!ROOT_KEYS.contains(String.valueOf(key))) {
                    unrecognized.add(String.valueOf(key));
                }
            }
            if (!unrecognized.isEmpty()) {
                throw error(null, "Unrecognized root keys: " + unrecognized
                        + " (expected some of: " + String.join(", ", new TreeSet<>(ROOT_KEYS)) + ")");
            }

            List<PendingAction> pending = new ArrayList<>();
            Object actionsNode = rootMap.get("actions");
            if (actionsNode != null) {
                if (!(actionsNode instanceof List)) {
                    throw error("actions", "'actions' contents should be a list (got " + typeName(actionsNode) + ")");
                }
                List<?> actionNodes = (List<?>) actionsNode;
                for (int i = 0; i < actionNodes.size(); i++) {
                    pending.add(action(actionNodes.get(i), "actions[" + i + "]"));
                }
            }

            // Dependencies are wired once every name is known so that external ones can be dropped.
            List<ActionDescriptor> actions = new ArrayList<>();
            for (PendingAction action : pending) {
                for (Dependency dependency : action.dependencies()) {
                    if (dependency.external() && !names.contains(dependency.name())) {
                        logger.debug("Dropping external dependency '{}' of action '{}'",
                                dependency.name(), action.name());
                    } else if (dependency.strict()) {
                        action.builder().dependsOnStrictly(dependency.name());
                    } else {
                        action.builder().dependsOn(dependency.name());
                    }
                }
                actions.add(action.builder().build());
            }

            Map<String, Object> context = new LinkedHashMap<>();
            Object contextNode = rootMap.get("context");
            if (contextNode instanceof Map) {
                mergeContext((Map<?, ?>) contextNode, "context", context);
            } else if (contextNode instanceof List) {
                List<?> items = (List<?>) contextNode;
                for (int i = 0; i < items.size(); i++) {
                    Object item = items.get(i);
                    if (!(item instanceof Map)) {
                        throw error("context[" + i + "]", "Context item is not a mapping (got " + typeName(item) + ")");
                    }
                    mergeContext((Map<?, ?>) item, "context[" + i + "]", context);
                }
            } else if (contextNode != null) {
                throw error("context", "'context' contents should be a mapping or a list (got " + typeName(contextNode) + ")");
            }

            return new WorkflowDefinition(source, actions, context);
        }

        private PendingAction action(Object node, String path) throws WorkflowLoadException {
            if (!(node instanceof Map)) {
                throw error(path, "Action should be a mapping (got " + typeName(node) + ")");
            }
            Map<?, ?> data = (Map<?, ?>) node;

            Object typeNode = data.get(TYPE);
            if (typeNode == null) {
                throw error(path, "'type' not specified for action");
            }
            if (!(typeNode instanceof String) || ((String) typeNode).isBlank()) {
                throw error(path + "." + TYPE, "Action type should be a non-empty string");
            }
            String type = ((String) typeNode).trim();

            // Every action of a type advances the counter, named or not.
            int ordinal = nameCounters.merge(type, 1, Integer::sum) - 1;
            String name;
            if (data.containsKey(NAME)) {
                Object nameNode = data.get(NAME);
                if (!(nameNode instanceof String) || ((String) nameNode).isBlank()) {
                    throw error(path + "." + NAME, "Action name should be a non-empty string");
                }
                name = ((String) nameNode).trim();
            } else {
                name = type + "-" + ordinal;
            }
            if (!names.add(name)) {
                throw error(path + "." + NAME, "Action declared twice: '" + name + "'");
            }

            ActionDescriptor.Builder builder = ActionDescriptor.builder(name).kind(type);

            if (data.containsKey(DESCRIPTION)) {
                Object description = data.get(DESCRIPTION);
                if (!(description instanceof String)) {
                    throw error(path + "." + DESCRIPTION, "Description should be a string (got " + typeName(description) + ")");
                }
                builder.description((String) description);
            }

            if (data.containsKey(SEVERITY)) {
                Object severity = data.get(SEVERITY);
                try {
                    builder.severity(ActionSeverity.fromValue(String.valueOf(severity)));
                } catch (IllegalArgumentException e) {
                    throw error(path + "." + SEVERITY, e.getMessage());
                }
            }

            List<Dependency> dependencies = expects(data.get(EXPECTS), path + "." + EXPECTS);
            builder.declaresOutcomes(outcomes(data.get(OUTCOMES), path + "." + OUTCOMES));

            for (Map.Entry<?, ?> entry : data.entrySet()) {
                String key = String.valueOf(entry.getKey());
                if (TYPE.equals(key) || NAME.equals(key) || DESCRIPTION.equals(key)
                        || EXPECTS.equals(key) || OUTCOMES.equals(key) || SEVERITY.equals(key)) {
                    continue;
                }
                builder.parameter(key, entry.getValue());
            }

            return new PendingAction(name, builder, dependencies);
        }

        private List<Dependency> expects(Object node, String path) throws WorkflowLoadException {
            List<Dependency> dependencies = new ArrayList<>();
            if (node == null) {
                return dependencies;
            }
            if (node instanceof String) {
                dependencies.add(new Dependency(requireId(node, path), false, false));
                return dependencies;
            }
            if (!(node instanceof List)) {
                throw error(path, "Expected a string or a list (got " + typeName(node) + ")");
            }
            List<?> items = (List<?>) node;
            for (int i = 0; i < items.size(); i++) {
                Object item = items.get(i);
                String itemPath = path + "[" + i + "]";
                if (item instanceof Map) {
                    dependencies.add(dependency((Map<?, ?>) item, itemPath));
                } else {
                    dependencies.add(new Dependency(requireId(item, itemPath), false, false));
                }
            }
            return dependencies;
        }

        private Dependency dependency(Map<?, ?> reference, String path) throws WorkflowLoadException {
            Set<String> unrecognized = new TreeSet<>();
            for (Object key : reference.keySet()) {
                if (!DEPENDENCY_KEYS.contains(String.valueOf(key))) {
                    unrecognized.add(String.valueOf(key));
                }
            }
            if (!unrecognized.isEmpty()) {
                throw error(path, "Unrecognized dependency node keys: " + unrecognized);
            }
            if (!reference.containsKey(NAME)) {
                throw error(path, "Dependency mapping has no 'name'");
            }
            String name = requireId(reference.get(NAME), path + "." + NAME);
            return new Dependency(name, flag(reference, STRICT, path), flag(reference, EXTERNAL, path));
        }

        private boolean flag(Map<?, ?> reference, String key, String path) throws WorkflowLoadException {
            Object value = reference.get(key);
            if (value == null) {
                return false;
            }
            if (!(value instanceof Boolean)) {
                throw error(path + "." + key, "'" + key + "' should be a boolean (got " + typeName(value) + ")");
            }
            return (Boolean) value;
        }

        private List<String> outcomes(Object node, String path) throws WorkflowLoadException {
            List<String> keys = new ArrayList<>();
            if (node == null) {
                return keys;
            }
            if (node instanceof String) {
                keys.add(requireId(node, path));
                return keys;
            }
            if (!(node instanceof List)) {
                throw error(path, "Declared outcomes should be a string or a list of strings (got " + typeName(node) + ")");
            }
            List<?> items = (List<?>) node;
            for (int i = 0; i < items.size(); i++) {
                keys.add(requireId(items.get(i), path + "[" + i + "]"));
            }
            return keys;
        }

        private void mergeContext(Map<?, ?> data, String path, Map<String, Object> context) throws WorkflowLoadException {
            for (Map.Entry<?, ?> entry : data.entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    throw error(path, "Context keys should be strings (got " + typeName(entry.getKey())
                            + " for " + entry.getKey() + ")");
                }
                String key = (String) entry.getKey();
                if (context.containsKey(key)) {
                    logger.debug("Context key redefined: {}", key);
                }
                context.put(key, entry.getValue());
            }
        }

        private String requireId(Object value, String path) throws WorkflowLoadException {
            if (!(value instanceof String) || ((String) value).isBlank()) {
                throw error(path, "Expected a non-empty string (got " + typeName(value) + ")");
            }
            return ((String) value).trim();
        }

        private WorkflowLoadException error(String fieldPath, String message) {
            return new WorkflowLoadException(source, -1, fieldPath, message, null);
        }

        private record Dependency(String name, boolean strict, boolean external) {
        }

        private record PendingAction(String name, ActionDescriptor.Builder builder, List<Dependency> dependencies) {
        }

        private static String typeName(Object value) {
            if (value == null) {
                return "null";
            }
            if (value instanceof Map) {
                return "mapping";
            }
            if (value instanceof List) {
                return "list";
            }
            return value.getClass().getSimpleName();
        }
    }
}
