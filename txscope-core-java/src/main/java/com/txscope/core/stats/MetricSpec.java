package com.txscope.core.stats;

import java.util.Objects;

/**
 * Key of one statistics bucket: a metric name plus the scope it was recorded under.
 *
 * An empty scope means the metric is unscoped. {@link #SCOPE_PLACEHOLDER} marks a metric
 * recorded before the enclosing transaction had a name; it is re-keyed to the resolved
 * transaction name when the transaction's stats are popped.
 */
public record MetricSpec(String name, String scope) {

    public static final String SCOPE_PLACEHOLDER = "__SCOPE__";

    public MetricSpec {
        Objects.requireNonNull(name, "name");
        scope = scope == null ? "" : scope;
    }

    public static MetricSpec unscoped(String name) {
        return new MetricSpec(name, "");
    }

    public static MetricSpec placeholderScoped(String name) {
        return new MetricSpec(name, SCOPE_PLACEHOLDER);
    }

    public boolean isPlaceholderScoped() {
        return !scope.isEmpty() && SCOPE_PLACEHOLDER.equals(scope);
    }

    public MetricSpec withScope(String newScope) {
        return new MetricSpec(name, newScope);
    }

    @Override
    public String toString() {
        return scope.isEmpty() ? name : name + " [" + scope + "]";
    }
}
