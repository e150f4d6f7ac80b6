package io.intellixity.arbor.selectast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SELECT statement tree. {@code limit}/{@code offset} are {@link SqlExpr.Literal} numbers or placeholder binds.
 */
public record SelectAst(List<SelectItem> items,
                        FromItem from,
                        List<Join> joins,
                        SqlExpr where,
                        List<OrderItem> orderBy,
                        SqlExpr limit,
                        SqlExpr offset) {
  public SelectAst {
    items = List.copyOf(items);
    Objects.requireNonNull(from, "from");
    if (items.isEmpty()) throw new IllegalArgumentException("SELECT without items");
    joins = List.copyOf(joins == null ? List.of() : joins);
    orderBy = List.copyOf(orderBy == null ? List.of() : orderBy);
  }

  public static Builder from(FromItem from) { return new Builder(from); }

  public static final class Builder {
    private final FromItem from;
    private final List<SelectItem> items = new ArrayList<>();
    private final List<Join> joins = new ArrayList<>();
    private final List<SqlExpr> where = new ArrayList<>();
    private final List<OrderItem> orderBy = new ArrayList<>();
    private SqlExpr limit;
    private SqlExpr offset;

    private Builder(FromItem from) {
      this.from = from;
    }

    public Builder select(SqlExpr expr, String label) {
      items.add(new SelectItem(expr, label));
      return this;
    }

    public Builder select(List<SelectItem> more) {
      items.addAll(more);
      return this;
    }

    public Builder join(Join join) {
      joins.add(join);
      return this;
    }

    public Builder joins(List<Join> more) {
      joins.addAll(more);
      return this;
    }

    /** Adds a conjunct; null is ignored. */
    public Builder where(SqlExpr expr) {
      if (expr != null) where.add(expr);
      return this;
    }

    public Builder orderBy(OrderItem item) {
      orderBy.add(item);
      return this;
    }

    public Builder orderBy(List<OrderItem> more) {
      orderBy.addAll(more);
      return this;
    }

    public Builder limit(SqlExpr limit) {
      this.limit = limit;
      return this;
    }

    public Builder offset(SqlExpr offset) {
      this.offset = offset;
      return this;
    }

    public SelectAst build() {
      return new SelectAst(items, from, joins, SqlExpr.and(where), orderBy, limit, offset);
    }
  }
}
