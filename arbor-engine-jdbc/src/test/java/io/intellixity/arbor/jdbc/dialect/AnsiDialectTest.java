package io.intellixity.arbor.jdbc.dialect;

import io.intellixity.arbor.compile.Bind;
import io.intellixity.arbor.compile.FetchStrategy;
import io.intellixity.arbor.error.PredicateException;
import io.intellixity.arbor.selectast.FromItem;
import io.intellixity.arbor.selectast.Join;
import io.intellixity.arbor.selectast.OrderItem;
import io.intellixity.arbor.selectast.SelectAst;
import io.intellixity.arbor.selectast.SqlExpr;
import io.intellixity.arbor.spi.sql.SqlStatement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AnsiDialectTest {
  private final AnsiDialect dialect = new AnsiDialect();

  private static SqlExpr col(String alias, String column) {
    return new SqlExpr.Column(alias, column);
  }

  private static SelectAst.Builder users() {
    return SelectAst.from(new FromItem.Table("users", "t0")).select(col("t0", "id"), "n0.id");
  }

  @Test
  void prefersBatchFetching() {
    assertEquals("ansi", dialect.id());
    assertEquals(FetchStrategy.BATCH, dialect.preferredStrategy());
  }

  @Test
  void rendersPagingAfterOrderWithBindsInTextOrder() {
    SelectAst select = users()
        .where(new SqlExpr.Compare(col("t0", "name"), "=", new SqlExpr.BindRef(Bind.value("alice", "string"))))
        .orderBy(new OrderItem(col("t0", "id"), true))
        .limit(new SqlExpr.BindRef(Bind.placeholder("size", "int")))
        .offset(new SqlExpr.BindRef(Bind.placeholder("skip", "int")))
        .build();

    SqlStatement s = dialect.render(select, "app", 1);
    assertEquals("SELECT \"t0\".\"id\" AS \"n0.id\" FROM \"app\".\"users\" \"t0\" WHERE \"t0\".\"name\" = :b1"
        + " ORDER BY \"t0\".\"id\" DESC OFFSET :b2 ROWS FETCH NEXT :b3 ROWS ONLY", s.sql());
    assertEquals("alice", s.binds().get(0).value());
    assertEquals("skip", s.binds().get(1).placeholder());
    assertEquals("size", s.binds().get(2).placeholder());
  }

  @Test
  void limitWithoutOffsetStartsAtZero() {
    SqlStatement s = dialect.render(users().limit(new SqlExpr.Literal("5")).build(), null, 1);
    assertEquals("SELECT \"t0\".\"id\" AS \"n0.id\" FROM \"users\" \"t0\" OFFSET 0 ROWS FETCH NEXT 5 ROWS ONLY", s.sql());
  }

  @Test
  void expandsSingleKeyBatchIntoInList() {
    SelectAst select = SelectAst.from(new FromItem.Table("posts", "t1"))
        .select(col("t1", "id"), "n1.id")
        .where(new SqlExpr.InBatch(List.of(col("t1", "owner_id")), List.of("int")))
        .build();

    SqlStatement s = dialect.render(select, null, 3);
    assertTrue(s.sql().endsWith("WHERE \"t1\".\"owner_id\" IN (:b1, :b2, :b3)"), s.sql());
    assertEquals(List.of(0, 1, 2), s.binds().stream().map(Bind::batchSlot).toList());
  }

  @Test
  void expandsCompositeKeyBatchIntoTuples() {
    SelectAst select = SelectAst.from(new FromItem.Table("memberships", "t1"))
        .select(col("t1", "role"), "n1.role")
        .where(new SqlExpr.InBatch(List.of(col("t1", "a"), col("t1", "b")), List.of("int", "string")))
        .build();

    SqlStatement s = dialect.render(select, null, 2);
    assertTrue(s.sql().endsWith("WHERE ((\"t1\".\"a\" = :b1 AND \"t1\".\"b\" = :b2) OR (\"t1\".\"a\" = :b3 AND \"t1\".\"b\" = :b4))"),
        s.sql());
    assertEquals(List.of(0, 1, 2, 3), s.binds().stream().map(Bind::batchSlot).toList());
    assertEquals("string", s.binds().get(3).logicalType());
  }

  @Test
  void batchFilterNeedsBatchSize() {
    SelectAst select = users().where(new SqlExpr.InBatch(List.of(col("t0", "id")), List.of("int"))).build();
    assertThrows(IllegalArgumentException.class, () -> dialect.render(select, null, 0));
  }

  @Test
  void constantsAndCaseInsensitiveLike() {
    SelectAst select = users()
        .join(new Join(Join.Type.LEFT, new FromItem.Table("posts", "t1"), null))
        .where(new SqlExpr.Or(List.of(
            new SqlExpr.BoolConst(false),
            new SqlExpr.Like(col("t0", "name"), new SqlExpr.BindRef(Bind.value("A%", "string")), true, false))))
        .build();

    String sql = dialect.render(select, null, 1).sql();
    assertTrue(sql.contains("LEFT JOIN \"posts\" \"t1\" ON 1 = 1"), sql);
    assertTrue(sql.endsWith("WHERE (1 = 0 OR LOWER(\"t0\".\"name\") LIKE LOWER(:b1))"), sql);
  }

  @Test
  void rendersWindowedDerivedTable() {
    SelectAst inner = SelectAst.from(new FromItem.Table("posts", "t1"))
        .select(col("t1", "id"), "n1.id")
        .select(new SqlExpr.RowNumber(List.of(col("t1", "owner_id")), List.of(new OrderItem(col("t1", "id"), false))), "n1#rn")
        .build();
    SelectAst outer = users()
        .join(new Join(Join.Type.LEFT, new FromItem.Derived(inner, "d1"),
            new SqlExpr.Compare(new SqlExpr.Column("d1", "n1#rn"), "<=", new SqlExpr.Literal("2"))))
        .build();

    String sql = dialect.render(outer, null, 1).sql();
    assertTrue(sql.contains("ROW_NUMBER() OVER (PARTITION BY \"t1\".\"owner_id\" ORDER BY \"t1\".\"id\" ASC) AS \"n1#rn\""), sql);
    assertTrue(sql.contains(") \"d1\" ON \"d1\".\"n1#rn\" <= 2"), sql);
  }

  @Test
  void rawTemplateSlots() {
    SelectAst select = users()
        .where(new SqlExpr.Raw("length({0}) > {1}", List.of(col("t0", "name"), new SqlExpr.BindRef(Bind.value(3, "int")))))
        .build();
    assertTrue(dialect.render(select, null, 1).sql().endsWith("WHERE (length(\"t0\".\"name\") > :b1)"));

    SelectAst bad = users().where(new SqlExpr.Raw("{0} = {1}", List.of(col("t0", "id")))).build();
    assertThrows(PredicateException.class, () -> dialect.render(bad, null, 1));
  }

  @Test
  void quotesEmbeddedQuotes() {
    SqlStatement s = dialect.render(
        SelectAst.from(new FromItem.Table("odd\"name", "t0")).select(col("t0", "id"), "n0.id").build(), null, 1);
    assertTrue(s.sql().contains("FROM \"odd\"\"name\" \"t0\""), s.sql());
  }
}
