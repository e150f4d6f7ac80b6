package io.intellixity.arbor.schema.yaml;

import io.intellixity.arbor.error.SchemaException;
import io.intellixity.arbor.query.Condition;
import io.intellixity.arbor.query.Operator;
import io.intellixity.arbor.schema.ColumnDef;
import io.intellixity.arbor.schema.DefaultPolicy;
import io.intellixity.arbor.schema.RelationDef;
import io.intellixity.arbor.schema.RelationKind;
import io.intellixity.arbor.schema.SchemaGraph;
import io.intellixity.arbor.schema.TableDef;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class YamlSchemaLoaderTest {
  private final YamlSchemaLoader loader = new YamlSchemaLoader();

  @Test
  void loadsTablesColumnsAndRelations() {
    SchemaGraph g = loader.loadResource("schema/blog.yaml");
    assertEquals(5, g.tables().size());

    TableDef users = g.table("users");
    assertEquals(List.of("id"), users.primaryKey());
    assertEquals(List.of("id", "name", "invitedBy"), users.columns().stream().map(ColumnDef::name).toList());

    ColumnDef id = users.column("id");
    assertTrue(id.generated());
    assertEquals(DefaultPolicy.DATABASE, id.defaultPolicy());
    ColumnDef invitedBy = users.column("invitedBy");
    assertEquals("invited_by", invitedBy.dbName());
    assertTrue(invitedBy.nullable());
    assertEquals("string", users.column("name").logicalType());

    RelationDef groups = users.relation("groups");
    assertEquals(RelationKind.MANY_THROUGH, groups.kind());
    assertEquals("usersToGroups", groups.through().table());

    RelationDef author = g.table("posts").relation("author");
    assertEquals(RelationKind.ONE, author.kind());
    assertFalse(author.optional());
    assertEquals(List.of("ownerId"), author.fromColumns());
  }

  @Test
  void readsRelationFilter() {
    RelationDef published = loader.loadResource("schema/blog.yaml").table("users").relation("publishedPosts");
    Condition c = assertInstanceOf(Condition.class, published.where());
    assertEquals("published", c.column());
    assertEquals(Operator.EQ, c.operator());
    assertEquals(Boolean.TRUE, c.value());
  }

  @Test
  void tableWithoutPrimaryKeyIsIdentifiedByAllColumns() {
    TableDef junction = loader.loadResource("schema/blog.yaml").table("usersToGroups");
    assertTrue(junction.primaryKey().isEmpty());
    assertEquals(List.of("userId", "groupId"), junction.identityColumns());
  }

  @Test
  void rejectsUnknownRelationKind() {
    String yaml = """
        tables:
          a:
            columns: { id: int }
            relations:
              b: { kind: several, target: a }
        """;
    SchemaException ex = assertThrows(SchemaException.class, () -> load(yaml));
    assertTrue(ex.getMessage().contains("several"));
  }

  @Test
  void rejectsUnknownTargetAndColumns() {
    String unknownTarget = """
        tables:
          a:
            columns: { id: int }
            relations:
              b: { kind: one, target: nope, from: id, to: id }
        """;
    assertThrows(SchemaException.class, () -> load(unknownTarget));

    String unknownColumn = """
        tables:
          a:
            columns: { id: int }
            relations:
              self: { kind: one, target: a, from: parentId, to: id }
        """;
    SchemaException ex = assertThrows(SchemaException.class, () -> load(unknownColumn));
    assertTrue(ex.getMessage().contains("a.parentId"));
  }

  @Test
  void rejectsMismatchedKeyCounts() {
    String yaml = """
        tables:
          a:
            columns: { id: int, x: int }
            relations:
              self: { kind: one, target: a, from: [id, x], to: id }
        """;
    assertThrows(SchemaException.class, () -> load(yaml));
  }

  @Test
  void rejectsDocumentWithoutTables() {
    assertThrows(SchemaException.class, () -> load("version: 1\n"));
    assertThrows(SchemaException.class, () -> loader.loadResource("schema/missing.yaml"));
  }

  private SchemaGraph load(String yaml) throws Exception {
    return loader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
  }
}
