package io.intellixity.couchlink.persistence.couch.constraint;

import io.intellixity.couchlink.persistence.authoring.FieldType;
import io.intellixity.couchlink.persistence.authoring.SchemaConfigurationException;
import io.intellixity.couchlink.persistence.authoring.SchemaDef;
import io.intellixity.couchlink.persistence.constraint.ConstraintKind;
import io.intellixity.couchlink.persistence.constraint.ConstraintReport;
import io.intellixity.couchlink.persistence.constraint.ConstraintResult;
import io.intellixity.couchlink.persistence.couch.InMemoryDocumentStore;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ConstraintEngineTest {
  private static final SchemaDef USER = SchemaDef.builder("User")
      .field("email", FieldType.STRING)
      .field("username", FieldType.STRING)
      .field("org_id", FieldType.ID)
      .unique("email-index")
      .unique("org_user", "org_id", "username")
      .foreignKey("org_id", "org")
      .build();

  private final ConstraintEngine engine = new ConstraintEngine();

  private static Map<String, Object> user(String email, String username, Object orgId) {
    Map<String, Object> m = new HashMap<>();
    m.put("email", email);
    m.put("username", username);
    m.put("org_id", orgId);
    return m;
  }

  @Test
  void freeValuesArePendingAndReferencedParentIsOk() {
    InMemoryDocumentStore store = new InMemoryDocumentStore().seed("org/7", Map.of("type", "org"));

    ConstraintReport r = engine.validate(store, USER, user("a@b.com", "ann", 7), null);

    assertEquals(List.of(
        ConstraintResult.pending("email-index", "user-a@b.com"),
        ConstraintResult.pending("org_user", "user-7-ann"),
        ConstraintResult.ok("org_id_fkey")), r.results());
    assertTrue(r.accepted());
    assertFalse(r.settled());
  }

  @Test
  void existingMarkerIsUniqueViolation() {
    InMemoryDocumentStore store = new InMemoryDocumentStore()
        .seed("org/7", Map.of("type", "org"))
        .seed("user-a@b.com", Map.of("type", "constraint"));

    ConstraintReport r = engine.validate(store, USER, user("a@b.com", "ann", 7), null);

    assertEquals(1, r.violations().size());
    assertEquals(ConstraintKind.UNIQUE, r.violations().get(0).kind());
    assertEquals("email-index", r.violations().get(0).constraint());
    assertEquals("user-a@b.com", r.violations().get(0).id());
    assertFalse(r.accepted());
  }

  @Test
  void missingParentIsForeignKeyViolation() {
    ConstraintReport r = engine.validate(new InMemoryDocumentStore(), USER, user("a@b.com", "ann", 9), null);

    assertEquals(1, r.violations().size());
    assertEquals(ConstraintKind.FOREIGN_KEY, r.violations().get(0).kind());
    assertEquals("org/9", r.violations().get(0).id());
  }

  @Test
  void nullReferenceIsAccepted() {
    SchemaDef schema = SchemaDef.builder("Post").field("author_id", FieldType.ID).foreignKey("author_id", "user").build();
    ConstraintReport r = engine.validate(new InMemoryDocumentStore(), schema, new HashMap<>(), null);
    assertEquals(List.of(ConstraintResult.ok("author_id_fkey")), r.results());
  }

  @Test
  void incompleteUniqueFieldsAreConfigurationErrors() {
    InMemoryDocumentStore store = new InMemoryDocumentStore().seed("org/7", Map.of("type", "org"));
    SchemaConfigurationException ex = assertThrows(SchemaConfigurationException.class,
        () -> engine.validate(store, USER, user("a@b.com", null, 7), null));
    assertTrue(ex.getMessage().contains("org_user"));
    assertTrue(ex.getMessage().contains("username"));
  }

  @Test
  void unchangedValuesOnUpdateSkipTheLookup() {
    InMemoryDocumentStore store = new InMemoryDocumentStore()
        .seed("org/7", Map.of("type", "org"))
        .seed("user-a@b.com", Map.of("type", "constraint"))
        .seed("user-7-ann", Map.of("type", "constraint"));
    Map<String, Object> prev = user("a@b.com", "ann", 7);

    ConstraintReport r = engine.validate(store, USER, Map.of("username", "bob"), prev);

    assertEquals(ConstraintResult.ok("email-index"), r.results().get(0));
    assertEquals(ConstraintResult.pending("org_user", "user-7-bob"), r.results().get(1));
    assertFalse(store.calls().contains("get user-a@b.com"));
  }

  @Test
  void lookupFailureIsErrorNotAbsence() {
    InMemoryDocumentStore store = new InMemoryDocumentStore()
        .seed("org/7", Map.of("type", "org"))
        .failGets(id -> id.startsWith("user-a@"));

    ConstraintReport r = engine.validate(store, USER, user("a@b.com", "ann", 7), null);

    assertEquals(List.of("email-index: timeout :: get user-a@b.com timed out"), r.errors());
    assertTrue(r.violations().isEmpty());
    assertFalse(r.accepted());
  }

  @Test
  void reserveWritesMarkerDocuments() {
    InMemoryDocumentStore store = new InMemoryDocumentStore().seed("org/7", Map.of("type", "org"));
    ConstraintReport validated = engine.validate(store, USER, user("a@b.com", "ann", 7), null);

    ConstraintReport reserved = engine.reserve(store, validated);

    assertTrue(reserved.settled());
    assertEquals(Map.of("_id", "user-a@b.com", "_rev", "1-mem", "type", "constraint"), store.doc("user-a@b.com"));
    assertTrue(store.contains("user-7-ann"));
  }

  @Test
  void markerTakenBetweenValidateAndReserveIsUniqueViolation() {
    InMemoryDocumentStore store = new InMemoryDocumentStore().seed("org/7", Map.of("type", "org"));
    ConstraintReport validated = engine.validate(store, USER, user("a@b.com", "ann", 7), null);
    // a concurrent writer reserves the second marker first
    store.seed("user-7-ann", Map.of("type", "constraint"));

    ConstraintReport reserved = engine.reserve(store, validated);

    assertEquals(1, reserved.violations().size());
    assertEquals("org_user", reserved.violations().get(0).constraint());
    assertFalse(store.contains("user-a@b.com"), "markers of a failed reservation are released");
  }

  @Test
  void reserveRefusesRejectedReports() {
    ConstraintReport rejected = new ConstraintReport(List.of(
        ConstraintResult.invalid(ConstraintKind.UNIQUE, "email-index", "user-a@b.com")));
    assertThrows(IllegalStateException.class, () -> engine.reserve(new InMemoryDocumentStore(), rejected));
  }

  @Test
  void markerIdJoinsSourceAndValues() {
    SchemaDef accounts = SchemaDef.builder("Account").source("accounts").unique("org_user", "org", "name").build();
    assertEquals("accounts-acme-bob",
        ConstraintEngine.markerId(accounts.source(), accounts.constraints().unique().get(0), Map.of("org", "acme", "name", "bob")));
  }
}
