package io.intellixity.arbor.relation;

import io.intellixity.arbor.error.AmbiguousRelationException;
import io.intellixity.arbor.error.SchemaException;
import io.intellixity.arbor.schema.RelationDef;
import io.intellixity.arbor.schema.RelationKind;
import io.intellixity.arbor.schema.SchemaGraph;
import io.intellixity.arbor.schema.TableDef;
import io.intellixity.arbor.schema.ThroughDef;
import io.intellixity.arbor.schema.yaml.YamlSchemaLoader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class RelationResolverTest {
  private final RelationResolver blog = new RelationResolver(new YamlSchemaLoader().loadResource("schema/blog.yaml"));

  @Test
  void usesDeclaredColumns() {
    JoinDescriptor d = blog.resolve("posts", "author");
    assertEquals(RelationKind.ONE, d.kind());
    assertEquals(List.of(new JoinKey("ownerId", "id")), d.joinKeys());
    assertFalse(d.optional());
    assertFalse(d.toMany());
  }

  @Test
  void infersColumnsFromReverseRelation() {
    JoinDescriptor d = blog.resolve("users", "posts");
    assertEquals("posts", d.targetTable());
    assertEquals(List.of(new JoinKey("id", "ownerId")), d.joinKeys());
    assertEquals(List.of("id"), d.sourceColumns());
    assertTrue(d.optional());
    assertTrue(d.toMany());
  }

  @Test
  void infersJunctionFromItsOneRelations() {
    JoinDescriptor d = blog.resolve("groups", "users");
    assertEquals(RelationKind.MANY_THROUGH, d.kind());
    assertTrue(d.joinKeys().isEmpty());
    Junction j = d.through();
    assertEquals("usersToGroups", j.table());
    assertEquals(List.of(new JoinKey("id", "groupId")), j.sourceKeys());
    assertEquals(List.of(new JoinKey("userId", "id")), j.targetKeys());
    assertEquals(List.of("id"), d.sourceColumns());

    Junction back = blog.resolve("users", "groups").through();
    assertEquals(List.of(new JoinKey("id", "userId")), back.sourceKeys());
    assertEquals(List.of(new JoinKey("groupId", "id")), back.targetKeys());
  }

  @Test
  void carriesRelationFilter() {
    assertNotNull(blog.resolve("users", "publishedPosts").relationFilter());
    assertNull(blog.resolve("users", "posts").relationFilter());
  }

  @Test
  void cachesUntilInvalidated() {
    JoinDescriptor first = blog.resolve("users", "posts");
    assertSame(first, blog.resolve("users", "posts"));
    blog.invalidate();
    JoinDescriptor again = blog.resolve("users", "posts");
    assertNotSame(first, again);
    assertEquals(first, again);
  }

  @Test
  void ambiguousReverseRelationsAreRejected() {
    RelationResolver r = new RelationResolver(twoWaysBetweenAccountsAndTransfers(null, null));
    AmbiguousRelationException ex = assertThrows(AmbiguousRelationException.class, () -> r.resolve("accounts", "transfers"));
    assertEquals("accounts", ex.table());
    assertEquals(List.of("transfers.sender", "transfers.receiver"), ex.candidates());
  }

  @Test
  void aliasPicksReverseRelation() {
    RelationResolver r = new RelationResolver(twoWaysBetweenAccountsAndTransfers("incoming", "incoming"));
    assertEquals(List.of(new JoinKey("id", "receiverId")), r.resolve("accounts", "transfers").joinKeys());
  }

  @Test
  void aliasWithoutMatchFails() {
    RelationResolver r = new RelationResolver(twoWaysBetweenAccountsAndTransfers("incoming", "other"));
    SchemaException ex = assertThrows(SchemaException.class, () -> r.resolve("accounts", "transfers"));
    assertFalse(ex instanceof AmbiguousRelationException);
  }

  @Test
  void missingReverseRelationFails() {
    SchemaGraph g = SchemaGraph.of(
        TableDef.builder("a").id("id", "int").relation(RelationDef.many("bs", "b")).build(),
        TableDef.builder("b").id("id", "int").column("aId", "int").build());
    SchemaException ex = assertThrows(SchemaException.class, () -> new RelationResolver(g).resolve("a", "bs"));
    assertTrue(ex.getMessage().contains("Cannot infer"));
  }

  @Test
  void junctionNamesBreakTies() {
    // two relations from the junction to people; names decide which side is which
    SchemaGraph g = SchemaGraph.of(
        TableDef.builder("people").id("id", "int")
            .relation(RelationDef.manyThrough("follows", "people", ThroughDef.of("follow")).alias("follower"))
            .build(),
        TableDef.builder("follow")
            .column("followerId", "int").column("followsId", "int")
            .relation(RelationDef.one("follower", "people").on("followerId", "id"))
            .relation(RelationDef.one("follows", "people").on("followsId", "id"))
            .build());
    Junction j = new RelationResolver(g).resolve("people", "follows").through();
    assertEquals(List.of(new JoinKey("id", "followerId")), j.sourceKeys());
    assertEquals(List.of(new JoinKey("followsId", "id")), j.targetKeys());
  }

  @Test
  void junctionWithUnnamedTwinRelationsIsAmbiguous() {
    SchemaGraph g = SchemaGraph.of(
        TableDef.builder("people").id("id", "int")
            .relation(RelationDef.manyThrough("links", "people", ThroughDef.of("link")))
            .build(),
        TableDef.builder("link")
            .column("aId", "int").column("bId", "int")
            .relation(RelationDef.one("a", "people").on("aId", "id"))
            .relation(RelationDef.one("b", "people").on("bId", "id"))
            .build());
    AmbiguousRelationException ex = assertThrows(AmbiguousRelationException.class,
        () -> new RelationResolver(g).resolve("people", "links"));
    assertEquals("people", ex.table());
    assertEquals("links", ex.relation());
    assertEquals(List.of("link.a", "link.b"), ex.candidates());
  }

  @Test
  void junctionWithTwoRelationsToTheSourceIsAmbiguous() {
    SchemaGraph g = SchemaGraph.of(
        TableDef.builder("users").id("id", "int")
            .relation(RelationDef.manyThrough("teams", "teams", ThroughDef.of("memberships")))
            .build(),
        TableDef.builder("teams").id("id", "int").build(),
        TableDef.builder("memberships")
            .column("ownerId", "int").column("memberId", "int").column("teamId", "int")
            .relation(RelationDef.one("owner", "users").on("ownerId", "id"))
            .relation(RelationDef.one("member", "users").on("memberId", "id"))
            .relation(RelationDef.one("team", "teams").on("teamId", "id"))
            .build());
    AmbiguousRelationException ex = assertThrows(AmbiguousRelationException.class,
        () -> new RelationResolver(g).resolve("users", "teams"));
    assertEquals(List.of("memberships.owner", "memberships.member", "memberships.team"), ex.candidates());
  }

  @Test
  void explicitJunctionColumns() {
    SchemaGraph g = SchemaGraph.of(
        TableDef.builder("tags").id("id", "int").build(),
        TableDef.builder("notes").id("id", "int")
            .relation(RelationDef.manyThrough("tags", "tags",
                ThroughDef.of("noteTags").columns(List.of("note"), List.of("tag"))).on("id", "id"))
            .build(),
        TableDef.builder("noteTags").column("note", "int").column("tag", "int").build());
    Junction j = new RelationResolver(g).resolve("notes", "tags").through();
    assertEquals(List.of(new JoinKey("id", "note")), j.sourceKeys());
    assertEquals(List.of(new JoinKey("tag", "id")), j.targetKeys());
  }

  private static SchemaGraph twoWaysBetweenAccountsAndTransfers(String alias, String receiverAlias) {
    RelationDef transfers = RelationDef.many("transfers", "transfers");
    if (alias != null) transfers = transfers.alias(alias);
    RelationDef receiver = RelationDef.one("receiver", "accounts").on("receiverId", "id");
    if (receiverAlias != null) receiver = receiver.alias(receiverAlias);
    return SchemaGraph.of(
        TableDef.builder("accounts").id("id", "int").relation(transfers).build(),
        TableDef.builder("transfers").id("id", "int")
            .column("senderId", "int").column("receiverId", "int")
            .relation(RelationDef.one("sender", "accounts").on("senderId", "id"))
            .relation(receiver)
            .build());
  }
}
