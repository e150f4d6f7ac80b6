package io.intellixity.arbor.jdbc;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class NamedParamSqlTest {
  @Test
  void replacesNamedBindsInOrder() {
    String sql = "SELECT \"t0\".\"id\" FROM \"users\" \"t0\" WHERE \"t0\".\"id\" IN (:b1, :b2) AND \"t0\".\"name\" = :b3";
    assertEquals("SELECT \"t0\".\"id\" FROM \"users\" \"t0\" WHERE \"t0\".\"id\" IN (?, ?) AND \"t0\".\"name\" = ?",
        NamedParamSql.toJdbcSql(sql));
    assertEquals(List.of("b1", "b2", "b3"), NamedParamSql.names(sql));
  }

  @Test
  void leavesQuotedTextAndCastsAlone() {
    String sql = "SELECT 'it''s :x', \"a:b\", c::text FROM t WHERE d = :p1";
    assertEquals("SELECT 'it''s :x', \"a:b\", c::text FROM t WHERE d = ?", NamedParamSql.toJdbcSql(sql));
    assertEquals(List.of("p1"), NamedParamSql.names(sql));
  }

  @Test
  void colonWithoutNameIsKept() {
    assertEquals("SELECT 1 : 2", NamedParamSql.toJdbcSql("SELECT 1 : 2"));
    assertEquals("", NamedParamSql.toJdbcSql(null));
    assertTrue(NamedParamSql.names(null).isEmpty());
  }
}
