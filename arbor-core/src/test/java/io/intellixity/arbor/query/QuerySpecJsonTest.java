package io.intellixity.arbor.query;

import io.intellixity.arbor.error.PredicateException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class QuerySpecJsonTest {
  @Test
  void readsNestedRequest() {
    String json = """
        {
          "table": "users",
          "columns": { "name": true },
          "where": { "name": { "ilike": "a%" } },
          "orderBy": { "name": "desc" },
          "limit": 10,
          "offset": { "$param": "skip" },
          "extras": { "postCount": { "count": "posts" } },
          "with": {
            "posts": { "limit": 1, "orderBy": [ { "column": "id", "dir": "desc" } ] },
            "groups": true
          }
        }
        """;
    QuerySpec q = QuerySpecJson.read(json);
    assertEquals("users", q.table());
    assertEquals(Map.of("name", true), q.columns());
    assertEquals(Filters.ilike("name", "a%"), q.where());
    assertEquals(SortField.desc("name"), q.orderBy().get(0));
    assertEquals(10, q.limit());
    assertEquals(QueryValues.param("skip"), q.offset());
    assertEquals(Expr.count("posts"), q.extras().get("postCount"));

    QuerySpec posts = q.with().get("posts");
    assertNull(posts.table());
    assertEquals(1, posts.limit());
    assertEquals(SortField.desc("id"), posts.orderBy().get(0));
    assertEquals(QuerySpec.all(), q.with().get("groups"));
  }

  @Test
  void writtenJsonReadsBackToEqualSpec() {
    QuerySpec q = QuerySpec.builder("users")
        .exclude("invitedBy")
        .where(Filters.or(Filters.eq("name", "a"), Filters.has("posts")))
        .orderBy(SortField.asc("name"))
        .limit(Filters.param("n"))
        .extra("shout", Expr.fn("upper", Expr.column("name")))
        .with("posts", b -> b.where(Filters.gt("id", 3)).limit(2).offset(1))
        .first()
        .build();
    assertEquals(q, QuerySpecJson.read(QuerySpecJson.write(q)));
  }

  @Test
  void invalidJsonIsPredicateError() {
    assertThrows(PredicateException.class, () -> QuerySpecJson.read("{ \"table\": "));
    assertThrows(PredicateException.class, () -> QuerySpecJson.read("{ \"table\": \"users\", \"limit\": \"ten\" }"));
    assertThrows(PredicateException.class, () -> QuerySpecJson.read("{ \"table\": \"users\", \"limit\": -1 }"));
  }
}
