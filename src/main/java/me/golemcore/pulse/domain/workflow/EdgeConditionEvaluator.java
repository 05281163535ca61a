package me.golemcore.pulse.domain.workflow;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.pulse.domain.model.WorkflowEdge.EdgeCondition;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates edge conditions and {@code condition} nodes against a run
 * context. A missing condition always holds; an unknown operator never does.
 */
public final class EdgeConditionEvaluator {

    public static final Set<String> OPERATORS = Set.of(
            "eq", "neq", "gt", "gte", "lt", "lte", "contains", "exists", "truthy");

    private EdgeConditionEvaluator() {
    }

    public static boolean isKnownOperator(String operator) {
        return operator != null && OPERATORS.contains(operator.toLowerCase(Locale.ROOT));
    }

    public static boolean matches(EdgeCondition condition, Map<String, Object> context) {
        if (condition == null) {
            return true;
        }
        if (condition.getField() == null || condition.getOperator() == null) {
            return false;
        }
        Object actual = ContextPaths.resolve(context, condition.getField());
        Object expected = condition.getValue();
        return switch (condition.getOperator().toLowerCase(Locale.ROOT)) {
            case "eq" -> valuesEqual(actual, expected);
            case "neq" -> !valuesEqual(actual, expected);
            case "gt" -> compare(actual, expected).map(result -> result > 0).orElse(false);
            case "gte" -> compare(actual, expected).map(result -> result >= 0).orElse(false);
            case "lt" -> compare(actual, expected).map(result -> result < 0).orElse(false);
            case "lte" -> compare(actual, expected).map(result -> result <= 0).orElse(false);
            case "contains" -> contains(actual, expected);
            case "exists" -> actual != null;
            case "truthy" -> isTruthy(actual);
            default -> false;
        };
    }

    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        if (value instanceof String text) {
            return !text.isBlank() && !"false".equalsIgnoreCase(text) && !"0".equals(text);
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }

    private static boolean valuesEqual(Object actual, Object expected) {
        Double left = toDouble(actual);
        Double right = toDouble(expected);
        if (left != null && right != null) {
            return Double.compare(left, right) == 0;
        }
        if (actual instanceof Boolean || expected instanceof Boolean) {
            return Objects.equals(String.valueOf(actual).toLowerCase(Locale.ROOT),
                    String.valueOf(expected).toLowerCase(Locale.ROOT));
        }
        return Objects.equals(actual != null ? actual.toString() : null,
                expected != null ? expected.toString() : null);
    }

    /**
     * Numeric comparison, empty when either side is not a number.
     */
    private static Optional<Integer> compare(Object actual, Object expected) {
        Double left = toDouble(actual);
        Double right = toDouble(expected);
        if (left == null || right == null) {
            return Optional.empty();
        }
        return Optional.of(Double.compare(left, right));
    }

    private static boolean contains(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return false;
        }
        if (actual instanceof Collection<?> collection) {
            return collection.stream().anyMatch(item -> valuesEqual(item, expected));
        }
        if (actual instanceof Map<?, ?> map) {
            return map.containsKey(String.valueOf(expected));
        }
        return actual.toString().contains(expected.toString());
    }

    static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
