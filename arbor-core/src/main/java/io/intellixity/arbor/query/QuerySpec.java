package io.intellixity.arbor.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.arbor.error.PredicateException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * One level of a nested read: table, projection, filter, ordering, paging, extras and the relations to load.
 * <p>
 * {@code table} is null for nested levels; it is taken from the relation target. {@code limit} and {@code offset}
 * are non-negative integers or {@link QueryValues.Param} placeholders. {@code columns} maps column names to
 * include/exclude flags: when any flag is {@code true} only the {@code true} columns are returned, otherwise the
 * {@code false} columns are dropped from the full column list.
 */
@JsonSerialize(using = QuerySpecJsonSerializer.class)
@JsonDeserialize(using = QuerySpecJsonDeserializer.class)
public record QuerySpec(String table,
                        Map<String, Boolean> columns,
                        Predicate where,
                        List<SortField> orderBy,
                        Object limit,
                        Object offset,
                        Map<String, Expr> extras,
                        Map<String, QuerySpec> with,
                        boolean first) {
  public QuerySpec {
    columns = ordered(columns);
    orderBy = List.copyOf(orderBy == null ? List.of() : orderBy);
    extras = ordered(extras);
    with = ordered(with);
    checkPaging("limit", limit);
    checkPaging("offset", offset);
  }

  private static <V> Map<String, V> ordered(Map<String, V> m) {
    if (m == null || m.isEmpty()) return Map.of();
    LinkedHashMap<String, V> copy = new LinkedHashMap<>();
    m.forEach((k, v) -> copy.put(Objects.requireNonNull(k, "key"), Objects.requireNonNull(v, "value of " + k)));
    return Collections.unmodifiableMap(copy);
  }

  private static void checkPaging(String what, Object v) {
    if (v == null || v instanceof QueryValues.Param) return;
    if (v instanceof Integer i && i >= 0) return;
    throw new PredicateException(what + " must be a non-negative integer or a placeholder, got: " + v);
  }

  /** Spec for a nested level that loads every column and nothing else. */
  public static QuerySpec all() { return builder().build(); }

  public static Builder builder(String table) { return new Builder().table(table); }

  public static Builder builder() { return new Builder(); }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.table = table;
    b.columns.putAll(columns);
    b.where = where;
    b.orderBy.addAll(orderBy);
    b.limit = limit;
    b.offset = offset;
    b.extras.putAll(extras);
    b.with.putAll(with);
    b.first = first;
    return b;
  }

  public static final class Builder {
    private String table;
    private final LinkedHashMap<String, Boolean> columns = new LinkedHashMap<>();
    private Predicate where;
    private final List<SortField> orderBy = new ArrayList<>();
    private Object limit;
    private Object offset;
    private final LinkedHashMap<String, Expr> extras = new LinkedHashMap<>();
    private final LinkedHashMap<String, QuerySpec> with = new LinkedHashMap<>();
    private boolean first;

    private Builder() {}

    public Builder table(String table) {
      this.table = table;
      return this;
    }

    public Builder where(Predicate where) {
      this.where = where;
      return this;
    }

    /** Filter in map form, see {@link FilterParser}. */
    public Builder where(Map<String, ?> filter) {
      this.where = FilterParser.parse(filter);
      return this;
    }

    public Builder orderBy(SortField... fields) {
      this.orderBy.addAll(Arrays.asList(fields));
      return this;
    }

    public Builder orderBy(List<SortField> fields) {
      this.orderBy.addAll(fields);
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public Builder limit(QueryValues.Param limit) {
      this.limit = limit;
      return this;
    }

    public Builder offset(int offset) {
      this.offset = offset;
      return this;
    }

    public Builder offset(QueryValues.Param offset) {
      this.offset = offset;
      return this;
    }

    /** Include only the given columns. */
    public Builder columns(String... include) {
      for (String c : include) columns.put(c, Boolean.TRUE);
      return this;
    }

    /** Drop the given columns from the full column list. */
    public Builder exclude(String... exclude) {
      for (String c : exclude) columns.put(c, Boolean.FALSE);
      return this;
    }

    public Builder columns(Map<String, Boolean> selection) {
      columns.putAll(selection);
      return this;
    }

    public Builder extra(String name, Expr expr) {
      extras.put(name, expr);
      return this;
    }

    public Builder with(String relation) {
      return with(relation, QuerySpec.all());
    }

    public Builder with(String relation, QuerySpec nested) {
      with.put(relation, nested);
      return this;
    }

    public Builder with(String relation, UnaryOperator<Builder> nested) {
      with.put(relation, nested.apply(new Builder()).build());
      return this;
    }

    /** At most one root row is returned. */
    public Builder first() {
      this.first = true;
      return this;
    }

    public QuerySpec build() {
      return new QuerySpec(table, columns, where, orderBy, limit, offset, extras, with, first);
    }
  }
}
