package com.flagship.rural_ledger.sync;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Filtered select against one remote table, expressed as PostgREST query
 * parameters ({@code column=op.value}).
 */
public final class RemoteQuery {

    private final String table;
    private String columns = "*";
    private final List<Map.Entry<String, String>> filters = new ArrayList<>();
    private String order;
    private Integer limit;

    private RemoteQuery(String table) {
        this.table = table;
    }

    public static RemoteQuery from(String table) {
        return new RemoteQuery(table);
    }

    public RemoteQuery select(String columns) {
        this.columns = columns;
        return this;
    }

    public RemoteQuery eq(String column, Object value) {
        return filter(column, "eq." + value);
    }

    public RemoteQuery gte(String column, Object value) {
        return filter(column, "gte." + value);
    }

    public RemoteQuery lte(String column, Object value) {
        return filter(column, "lte." + value);
    }

    public RemoteQuery in(String column, Collection<?> values) {
        String list = values.stream().map(String::valueOf).collect(Collectors.joining(","));
        return filter(column, "in.(" + list + ")");
    }

    public RemoteQuery order(String column, boolean ascending) {
        String clause = column + (ascending ? ".asc" : ".desc");
        this.order = order == null ? clause : order + "," + clause;
        return this;
    }

    public RemoteQuery limit(int limit) {
        this.limit = limit;
        return this;
    }

    public String getTable() {
        return table;
    }

    /**
     * Query parameters in insertion order: select, filters, order, limit.
     */
    public List<Map.Entry<String, String>> toParameters() {
        List<Map.Entry<String, String>> params = new ArrayList<>();
        params.add(Map.entry("select", columns));
        params.addAll(filters);
        if (order != null) {
            params.add(Map.entry("order", order));
        }
        if (limit != null) {
            params.add(Map.entry("limit", String.valueOf(limit)));
        }
        return params;
    }

    private RemoteQuery filter(String column, String expression) {
        filters.add(Map.entry(column, expression));
        return this;
    }

    @Override
    public String toString() {
        return table + "?" + toParameters().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining("&"));
    }
}
