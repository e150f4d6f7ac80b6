package io.intellixity.arbor.jdbc.dialect;

import io.intellixity.arbor.compile.FetchStrategy;
import io.intellixity.arbor.selectast.SqlExpr;

/**
 * Portable SQL:2008 rendering: {@code OFFSET .. ROWS FETCH NEXT .. ROWS ONLY} paging and {@code 1 = 1} boolean
 * constants. Prefers BATCH fetching, which needs no join support beyond what every backend has.
 */
public class AnsiDialect extends AbstractJdbcSqlDialect {
  public static final String ID = "ansi";

  @Override
  public String id() { return ID; }

  @Override
  public FetchStrategy preferredStrategy() { return FetchStrategy.BATCH; }

  @Override
  protected void appendPaging(StringBuilder sb, SqlExpr limit, SqlExpr offset, RenderCtx ctx) {
    sb.append(" OFFSET ").append(offset == null ? "0" : renderExpr(offset, ctx)).append(" ROWS");
    if (limit != null) sb.append(" FETCH NEXT ").append(renderExpr(limit, ctx)).append(" ROWS ONLY");
  }

  @Override
  protected String booleanLiteral(boolean value) {
    return value ? "1 = 1" : "1 = 0";
  }
}
