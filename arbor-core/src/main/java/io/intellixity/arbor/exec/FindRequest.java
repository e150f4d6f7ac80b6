package io.intellixity.arbor.exec;

import io.intellixity.arbor.query.Expr;
import io.intellixity.arbor.query.Predicate;
import io.intellixity.arbor.query.QuerySpec;
import io.intellixity.arbor.query.QueryValues;
import io.intellixity.arbor.query.SortField;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * Fluent request bound to an engine:
 * <pre>
 * engine.find("users")
 *     .where(Filters.eq("active", true))
 *     .with("posts", q -&gt; q.orderBy(SortField.desc("id")).limit(1))
 *     .limit(10)
 *     .execute();
 * </pre>
 */
public final class FindRequest {
  private final QueryEngine<?> engine;
  private final QuerySpec.Builder spec;

  FindRequest(QueryEngine<?> engine, String table) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.spec = QuerySpec.builder(Objects.requireNonNull(table, "table"));
  }

  public FindRequest where(Predicate where) {
    spec.where(where);
    return this;
  }

  public FindRequest where(Map<String, ?> filter) {
    spec.where(filter);
    return this;
  }

  public FindRequest with(String relation) {
    spec.with(relation);
    return this;
  }

  public FindRequest with(String relation, UnaryOperator<QuerySpec.Builder> nested) {
    spec.with(relation, nested);
    return this;
  }

  public FindRequest with(String relation, QuerySpec nested) {
    spec.with(relation, nested);
    return this;
  }

  public FindRequest orderBy(SortField... fields) {
    spec.orderBy(fields);
    return this;
  }

  public FindRequest limit(int limit) {
    spec.limit(limit);
    return this;
  }

  public FindRequest limit(QueryValues.Param limit) {
    spec.limit(limit);
    return this;
  }

  public FindRequest offset(int offset) {
    spec.offset(offset);
    return this;
  }

  public FindRequest offset(QueryValues.Param offset) {
    spec.offset(offset);
    return this;
  }

  public FindRequest columns(String... include) {
    spec.columns(include);
    return this;
  }

  public FindRequest exclude(String... exclude) {
    spec.exclude(exclude);
    return this;
  }

  public FindRequest extra(String name, Expr expr) {
    spec.extra(name, expr);
    return this;
  }

  public FindRequest extras(Map<String, Expr> extras) {
    extras.forEach(spec::extra);
    return this;
  }

  public QuerySpec spec() {
    return spec.build();
  }

  public PreparedQuery prepare() {
    return engine.prepare(spec());
  }

  public List<Map<String, Object>> execute() {
    return engine.execute(spec());
  }

  public List<Map<String, Object>> execute(Map<String, ?> bindings) {
    return engine.execute(spec(), bindings);
  }

  public CompletableFuture<List<Map<String, Object>>> executeAsync() {
    return engine.executeAsync(spec(), Map.of());
  }

  public CompletableFuture<List<Map<String, Object>>> executeAsync(Map<String, ?> bindings) {
    return engine.executeAsync(spec(), bindings);
  }

  public Optional<Map<String, Object>> findOne() {
    return engine.findOne(spec(), Map.of());
  }

  public Optional<Map<String, Object>> findOne(Map<String, ?> bindings) {
    return engine.findOne(spec(), bindings);
  }
}
