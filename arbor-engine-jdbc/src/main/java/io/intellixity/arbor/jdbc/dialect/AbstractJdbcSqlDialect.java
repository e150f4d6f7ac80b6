package io.intellixity.arbor.jdbc.dialect;

import io.intellixity.arbor.compile.Bind;
import io.intellixity.arbor.error.PredicateException;
import io.intellixity.arbor.selectast.FromItem;
import io.intellixity.arbor.selectast.Join;
import io.intellixity.arbor.selectast.OrderItem;
import io.intellixity.arbor.selectast.SelectAst;
import io.intellixity.arbor.selectast.SelectItem;
import io.intellixity.arbor.selectast.SqlExpr;
import io.intellixity.arbor.spi.sql.SqlStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * JDBC-generic renderer from {@link SelectAst} to SQL text with named binds ({@code :b1}, {@code :b2}, ...).
 * Binds are numbered in textual order, so the bind list lines up with the {@code ?} markers after rewriting.
 * <p>
 * Dialects override hooks for identifier quoting, paging, case-insensitive LIKE and boolean literals.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  protected static final class RenderCtx {
    private final String namespace;
    private final int batchSize;
    private final List<Bind> binds = new ArrayList<>();

    private RenderCtx(String namespace, int batchSize) {
      this.namespace = namespace;
      this.batchSize = batchSize;
    }

    public String add(Bind b) {
      binds.add(b);
      return ":b" + binds.size();
    }

    public String namespace() { return namespace; }
  }

  @Override
  public final SqlStatement render(SelectAst select, String namespace, int batchSize) {
    RenderCtx ctx = new RenderCtx(namespace, batchSize);
    String sql = renderSelect(select, ctx);
    return new SqlStatement(sql, ctx.binds);
  }

  protected String renderSelect(SelectAst s, RenderCtx ctx) {
    StringBuilder sb = new StringBuilder("SELECT ");
    List<String> items = new ArrayList<>(s.items().size());
    for (SelectItem item : s.items()) {
      String e = renderExpr(item.expr(), ctx);
      items.add(item.label() == null ? e : e + " AS " + quoteIdent(item.label()));
    }
    sb.append(String.join(", ", items));
    sb.append(" FROM ").append(renderFrom(s.from(), ctx));
    for (Join j : s.joins()) {
      sb.append(j.type() == Join.Type.LEFT ? " LEFT JOIN " : " INNER JOIN ");
      sb.append(renderFrom(j.item(), ctx)).append(" ON ").append(renderExpr(j.on(), ctx));
    }
    if (s.where() != null) sb.append(" WHERE ").append(renderExpr(s.where(), ctx));
    if (!s.orderBy().isEmpty()) sb.append(" ORDER BY ").append(renderOrder(s.orderBy(), ctx));
    if (s.limit() != null || s.offset() != null) appendPaging(sb, s.limit(), s.offset(), ctx);
    return sb.toString();
  }

  protected String renderFrom(FromItem item, RenderCtx ctx) {
    if (item instanceof FromItem.Table t) return qualify(ctx.namespace(), t.name()) + " " + quoteIdent(t.alias());
    if (item instanceof FromItem.Derived d) return "(" + renderSelect(d.query(), ctx) + ") " + quoteIdent(d.alias());
    throw new IllegalArgumentException("Unknown FROM item: " + item);
  }

  protected String qualify(String namespace, String table) {
    if (namespace == null) return quoteIdent(table);
    return quoteIdent(namespace) + "." + quoteIdent(table);
  }

  private String renderOrder(List<OrderItem> order, RenderCtx ctx) {
    List<String> parts = new ArrayList<>(order.size());
    for (OrderItem o : order) parts.add(renderExpr(o.expr(), ctx) + (o.descending() ? " DESC" : " ASC"));
    return String.join(", ", parts);
  }

  protected String renderExpr(SqlExpr e, RenderCtx ctx) {
    if (e instanceof SqlExpr.Column c) return quoteIdent(c.alias()) + "." + quoteIdent(c.column());
    if (e instanceof SqlExpr.BindRef b) return ctx.add(b.bind());
    if (e instanceof SqlExpr.Literal l) return l.sql();
    if (e instanceof SqlExpr.BoolConst b) return booleanLiteral(b.value());
    if (e instanceof SqlExpr.Compare c) return renderExpr(c.left(), ctx) + " " + c.op() + " " + renderExpr(c.right(), ctx);
    if (e instanceof SqlExpr.Like l) {
      String left = renderExpr(l.left(), ctx);
      String pattern = renderExpr(l.pattern(), ctx);
      if (l.caseInsensitive()) return renderIlike(left, pattern, l.negated());
      return left + (l.negated() ? " NOT LIKE " : " LIKE ") + pattern;
    }
    if (e instanceof SqlExpr.IsNull n) return renderExpr(n.expr(), ctx) + (n.negated() ? " IS NOT NULL" : " IS NULL");
    if (e instanceof SqlExpr.InList in) {
      String left = renderExpr(in.left(), ctx);
      List<String> values = new ArrayList<>(in.values().size());
      for (SqlExpr v : in.values()) values.add(renderExpr(v, ctx));
      return left + (in.negated() ? " NOT IN (" : " IN (") + String.join(", ", values) + ")";
    }
    if (e instanceof SqlExpr.InSubquery in) {
      return renderExpr(in.left(), ctx) + (in.negated() ? " NOT IN (" : " IN (") + renderSelect(in.query(), ctx) + ")";
    }
    if (e instanceof SqlExpr.InBatch b) return renderBatch(b, ctx);
    if (e instanceof SqlExpr.Between b) {
      String expr = renderExpr(b.expr(), ctx);
      String lo = renderExpr(b.lower(), ctx);
      String hi = renderExpr(b.upper(), ctx);
      return expr + (b.negated() ? " NOT BETWEEN " : " BETWEEN ") + lo + " AND " + hi;
    }
    if (e instanceof SqlExpr.And a) return join(a.items(), " AND ", ctx);
    if (e instanceof SqlExpr.Or o) return join(o.items(), " OR ", ctx);
    if (e instanceof SqlExpr.Not n) return "NOT (" + renderExpr(n.item(), ctx) + ")";
    if (e instanceof SqlExpr.Exists x) return (x.negated() ? "NOT EXISTS (" : "EXISTS (") + renderSelect(x.query(), ctx) + ")";
    if (e instanceof SqlExpr.Function f) {
      List<String> args = new ArrayList<>(f.args().size());
      for (SqlExpr a : f.args()) args.add(renderExpr(a, ctx));
      return f.name() + "(" + String.join(", ", args) + ")";
    }
    if (e instanceof SqlExpr.Raw r) return "(" + renderRaw(r, ctx) + ")";
    if (e instanceof SqlExpr.Scalar s) return "(" + renderSelect(s.query(), ctx) + ")";
    if (e instanceof SqlExpr.CountAll) return "COUNT(*)";
    if (e instanceof SqlExpr.Plus p) return "(" + renderExpr(p.left(), ctx) + " + " + renderExpr(p.right(), ctx) + ")";
    if (e instanceof SqlExpr.RowNumber rn) {
      StringBuilder sb = new StringBuilder("ROW_NUMBER() OVER (");
      if (!rn.partitionBy().isEmpty()) {
        List<String> parts = new ArrayList<>();
        for (SqlExpr p : rn.partitionBy()) parts.add(renderExpr(p, ctx));
        sb.append("PARTITION BY ").append(String.join(", ", parts));
      }
      if (!rn.orderBy().isEmpty()) {
        if (!rn.partitionBy().isEmpty()) sb.append(' ');
        sb.append("ORDER BY ").append(renderOrder(rn.orderBy(), ctx));
      }
      return sb.append(')').toString();
    }
    throw new IllegalArgumentException("Unsupported expression: " + e);
  }

  private String join(List<SqlExpr> items, String sep, RenderCtx ctx) {
    List<String> parts = new ArrayList<>(items.size());
    for (SqlExpr i : items) parts.add(renderExpr(i, ctx));
    return "(" + String.join(sep, parts) + ")";
  }

  /** {@code {n}} slots are replaced left to right, so binds follow the order the slots appear in. */
  private String renderRaw(SqlExpr.Raw r, RenderCtx ctx) {
    String t = r.template();
    StringBuilder out = new StringBuilder(t.length());
    int i = 0;
    while (i < t.length()) {
      char ch = t.charAt(i);
      if (ch == '{') {
        int close = t.indexOf('}', i + 1);
        if (close > i + 1 && isDigits(t, i + 1, close)) {
          int idx = Integer.parseInt(t.substring(i + 1, close));
          if (idx >= r.args().size()) {
            throw new PredicateException("Raw SQL slot {" + idx + "} has no argument (" + r.args().size() + " given)");
          }
          out.append(renderExpr(r.args().get(idx), ctx));
          i = close + 1;
          continue;
        }
      }
      out.append(ch);
      i++;
    }
    return out.toString();
  }

  private static boolean isDigits(String s, int from, int to) {
    for (int i = from; i < to; i++) if (!Character.isDigit(s.charAt(i))) return false;
    return true;
  }

  /** Key tuples of the current batch; one IN list for single keys, OR of conjunctions for composite keys. */
  protected String renderBatch(SqlExpr.InBatch b, RenderCtx ctx) {
    if (ctx.batchSize < 1) throw new IllegalArgumentException("Batch filter rendered without a batch size");
    int width = b.keys().size();
    if (width == 1) {
      String key = renderExpr(b.keys().get(0), ctx);
      List<String> ph = new ArrayList<>(ctx.batchSize);
      for (int i = 0; i < ctx.batchSize; i++) ph.add(ctx.add(Bind.batch(i, b.logicalTypes().get(0))));
      return key + " IN (" + String.join(", ", ph) + ")";
    }
    List<String> tuples = new ArrayList<>(ctx.batchSize);
    for (int i = 0; i < ctx.batchSize; i++) {
      List<String> eq = new ArrayList<>(width);
      for (int k = 0; k < width; k++) {
        eq.add(renderExpr(b.keys().get(k), ctx) + " = " + ctx.add(Bind.batch(i * width + k, b.logicalTypes().get(k))));
      }
      tuples.add("(" + String.join(" AND ", eq) + ")");
    }
    return "(" + String.join(" OR ", tuples) + ")";
  }

  /** Default renders {@code LIMIT n OFFSET m}. */
  protected void appendPaging(StringBuilder sb, SqlExpr limit, SqlExpr offset, RenderCtx ctx) {
    if (limit != null) sb.append(" LIMIT ").append(renderExpr(limit, ctx));
    if (offset != null) sb.append(" OFFSET ").append(renderExpr(offset, ctx));
  }

  /** Default lower-cases both sides; dialects with a native operator override. */
  protected String renderIlike(String left, String pattern, boolean negated) {
    return "LOWER(" + left + ")" + (negated ? " NOT LIKE " : " LIKE ") + "LOWER(" + pattern + ")";
  }

  protected String booleanLiteral(boolean value) {
    return value ? "TRUE" : "FALSE";
  }

  protected String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }
}
