package me.golemcore.pulse.domain.service;

import java.util.Locale;

/**
 * Metric comparisons shared by heartbeat checks and METRIC trigger rules.
 *
 * <p>
 * Level operators ({@code gt, gte, lt, lte, eq, neq}) compare the current
 * value with the threshold. Change operators ({@code increases_by,
 * decreases_by, changes_by}) compare the change since the previous snapshot,
 * absolute or in percent, and never match without a previous value.
 */
public final class MetricConditions {

    private static final double EPSILON = 1e-9;

    private MetricConditions() {
    }

    public static boolean matches(String operator, Double current, Double previous, double threshold,
            boolean percent) {
        if (operator == null || current == null) {
            return false;
        }
        return switch (operator.trim().toLowerCase(Locale.ROOT)) {
            case "gt" -> current > threshold;
            case "gte" -> current >= threshold;
            case "lt" -> current < threshold;
            case "lte" -> current <= threshold;
            case "eq" -> Math.abs(current - threshold) < EPSILON;
            case "neq" -> Math.abs(current - threshold) >= EPSILON;
            case "increases_by" -> previous != null && change(current, previous, percent) >= threshold;
            case "decreases_by" -> previous != null && change(current, previous, percent) <= -threshold;
            case "changes_by" -> previous != null && Math.abs(change(current, previous, percent)) >= threshold;
            default -> false;
        };
    }

    public static boolean isKnownOperator(String operator) {
        if (operator == null) {
            return false;
        }
        return switch (operator.trim().toLowerCase(Locale.ROOT)) {
            case "gt", "gte", "lt", "lte", "eq", "neq", "increases_by", "decreases_by", "changes_by" -> true;
            default -> false;
        };
    }

    static double change(double current, double previous, boolean percent) {
        if (percent && previous > 0) {
            return (current - previous) / previous * 100.0;
        }
        return current - previous;
    }
}
