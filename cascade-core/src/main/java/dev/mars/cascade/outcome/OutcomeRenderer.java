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

import dev.mars.cascade.core.exceptions.RenderException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes outcome, status, context and environment references in action parameters.
 *
 * <p>Supported references:</p>
 * <ul>
 *   <li>{@code @{build.version}} or {@code @{outcomes.build.version}} / {@code @{out.build.version}}:
 *       outcome {@code version} of action {@code build}</li>
 *   <li>{@code @{status.build}}: current state of action {@code build}</li>
 *   <li>{@code @{context.region}} / {@code @{ctx.region}}: workflow context variable</li>
 *   <li>{@code @{environment.HOME}} / {@code @{env.HOME}}: process environment, empty when unset</li>
 * </ul>
 * <p><code>@@{</code> renders as a literal <code>@{</code>. The namespace words take precedence over
 * action ids; an action named {@code status} is reached through {@code @{out.status.key}}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class OutcomeRenderer {

    private static final Pattern REFERENCE_PATTERN = Pattern.compile("@@\\{|@\\{([^}]*)(\\})?");

    /** Context values may reference each other; this bounds the chain. */
    static final int MAX_DEPTH = 20;

    /**
     * Renders every string leaf of a parameter tree. Lists and maps are copied, other values
     * are returned as is.
     *
     * @param parameters raw parameters
     * @param context    what references resolve against
     * @return a new, fully rendered parameter map
     * @throws RenderException on the first reference that cannot be resolved
     */
    public Map<String, Object> render(Map<String, Object> parameters, RenderContext context) throws RenderException {
        Objects.requireNonNull(parameters, "Parameters cannot be null");
        Map<String, Object> rendered = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : parameters.entrySet()) {
            rendered.put(entry.getKey(), renderValue(entry.getValue(), context));
        }
        return rendered;
    }

    /**
     * Renders a single template string.
     */
    public String render(String template, RenderContext context) throws RenderException {
        return render(template, context, 0);
    }

    private String render(String template, RenderContext context, int depth) throws RenderException {
        if (template == null) {
            return null;
        }
        if (depth >= MAX_DEPTH) {
            throw new RenderException(RenderException.Kind.RECURSION_LIMIT, template,
                    "Recursion depth exceeded: " + depth + "/" + MAX_DEPTH + " while rendering '" + template + "'");
        }

        Matcher matcher = REFERENCE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String replacement;
            if (matcher.group().startsWith("@@")) {
                replacement = "@{";
            } else if (matcher.group(2) == null) {
                throw new RenderException(RenderException.Kind.MALFORMED_REFERENCE, matcher.group(),
                        "Unterminated reference in: " + template);
            } else {
                replacement = resolveExpression(matcher.group(1).trim(), context, depth);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    private Object renderValue(Object value, RenderContext context) throws RenderException {
        return renderValue(value, context, 0);
    }

    private Object renderValue(Object value, RenderContext context, int depth) throws RenderException {
        if (value instanceof String) {
            return render((String) value, context, depth);
        }
        if (value instanceof Map) {
            Map<Object, Object> rendered = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                rendered.put(entry.getKey(), renderValue(entry.getValue(), context, depth));
            }
            return rendered;
        }
        if (value instanceof List) {
            List<Object> rendered = new ArrayList<>();
            for (Object item : (List<?>) value) {
                rendered.add(renderValue(item, context, depth));
            }
            return rendered;
        }
        return value;
    }

    private String resolveExpression(String expression, RenderContext context, int depth) throws RenderException {
        if (expression.isEmpty()) {
            throw new RenderException(RenderException.Kind.MALFORMED_REFERENCE, expression, "Empty reference");
        }
        List<String> parts = new ArrayList<>();
        for (String part : expression.split("\\.", -1)) {
            if (part.isBlank()) {
                throw new RenderException(RenderException.Kind.MALFORMED_REFERENCE, expression,
                        "Malformed reference: '" + expression + "'");
            }
            parts.add(part.trim());
        }

        switch (parts.get(0)) {
            case "outcomes":
            case "out":
                requireParts(expression, parts, 3);
                return resolveOutcome(expression, parts.get(1), join(parts, 2), context);
            case "status":
                requireParts(expression, parts, 2);
                if (parts.size() > 2) {
                    throw new RenderException(RenderException.Kind.MALFORMED_REFERENCE, expression,
                            "Status reference takes exactly one action id: '" + expression + "'");
                }
                requireKnownAction(expression, parts.get(1), context);
                return context.getState(parts.get(1)).name();
            case "context":
            case "ctx":
                requireParts(expression, parts, 2);
                return resolveContextVariable(expression, parts.subList(1, parts.size()), context, depth);
            case "environment":
            case "env":
                requireParts(expression, parts, 2);
                String value = context.getEnvironmentVariable(join(parts, 1));
                return value != null ? value : "";
            default:
                requireParts(expression, parts, 2);
                return resolveOutcome(expression, parts.get(0), join(parts, 1), context);
        }
    }

    private String resolveOutcome(String expression, String actionId, String key, RenderContext context)
            throws RenderException {
        requireKnownAction(expression, actionId, context);
        Optional<String> value = context.getLedger().get(actionId, key);
        if (value.isPresent()) {
            return value.get();
        }
        if (context.getMode() == RenderingMode.STRICT) {
            throw new RenderException(RenderException.Kind.MISSING_OUTCOME, expression,
                    "Outcome key '" + key + "' not found for action '" + actionId + "'");
        }
        return "";
    }

    /**
     * A dotted key matches a top-level variable of that exact name first, then a path through
     * nested mappings. String values are rendered in turn, so context entries may reference
     * outcomes or other context entries.
     */
    private String resolveContextVariable(String expression, List<String> path, RenderContext context, int depth)
            throws RenderException {
        Map<String, Object> variables = context.getVariables();
        String key = String.join(".", path);
        Object value;
        if (variables.containsKey(key)) {
            value = variables.get(key);
        } else {
            value = variables;
            for (String segment : path) {
                if (!(value instanceof Map) || !((Map<?, ?>) value).containsKey(segment)) {
                    throw new RenderException(RenderException.Kind.MISSING_CONTEXT_KEY, expression,
                            "Context key '" + key + "' not found");
                }
                value = ((Map<?, ?>) value).get(segment);
            }
        }
        return String.valueOf(renderValue(value, context, depth + 1));
    }

    private static void requireKnownAction(String expression, String actionId, RenderContext context)
            throws RenderException {
        if (!context.isKnownAction(actionId)) {
            throw new RenderException(RenderException.Kind.UNKNOWN_ACTION, expression,
                    "Action not found: '" + actionId + "'");
        }
    }

    private static void requireParts(String expression, List<String> parts, int minimum) throws RenderException {
        if (parts.size() < minimum) {
            throw new RenderException(RenderException.Kind.MALFORMED_REFERENCE, expression,
                    "Malformed reference: '" + expression + "'");
        }
    }

    private static String join(List<String> parts, int from) {
        return String.join(".", parts.subList(from, parts.size()));
    }
}
