package io.intellixity.couchlink.persistence.couch;

import io.intellixity.couchlink.persistence.authoring.FieldType;
import io.intellixity.couchlink.persistence.authoring.SchemaDef;
import io.intellixity.couchlink.persistence.query.*;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.couchlink.persistence.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class CouchQueryCompilerTest {
  private static final SchemaDef USER = SchemaDef.builder("User")
      .field("email", FieldType.STRING)
      .field("age", FieldType.INTEGER)
      .field("role", FieldType.STRING)
      .build();

  @Test
  void equalityCompilesToScopedSelector() {
    CompiledQuery q = CouchQueryCompiler.compile(USER, Query.of(eq("email", "a@b.com")));

    CompiledQuery.Selector s = assertInstanceOf(CompiledQuery.Selector.class, q);
    assertEquals(Map.of("type", "user", "email", "a@b.com"), s.selector());
    assertEquals(List.of("type", "email"), List.copyOf(s.selector().keySet()));
  }

  @Test
  void primaryKeyListCompilesToBatchGet() {
    CompiledQuery q = CouchQueryCompiler.compile(USER, Query.of(in("id", List.of(1, 2, 3))));
    assertEquals(new CompiledQuery.BatchGet(List.of("user/1", "user/2", "user/3")), q);
  }

  @Test
  void primaryKeyScalarCompilesToPointGet() {
    assertEquals(new CompiledQuery.PointGet("user/42"), CouchQueryCompiler.compile(USER, Query.of(eq("id", 42))));
    // already qualified ids are not qualified twice
    assertEquals(new CompiledQuery.PointGet("user/42"), CouchQueryCompiler.compile(USER, Query.of(eq("_id", "user/42"))));
  }

  @Test
  void placeholderOnPrimaryKeyResolvesPositionally() {
    Query q = Query.of(eq("id", QueryValues.placeholder(1))).withParams(List.of("ignored", "7"));
    assertEquals(new CompiledQuery.PointGet("user/7"), CouchQueryCompiler.compile(USER, q));

    Query batch = Query.of(eq("id", QueryValues.placeholder(0))).withParams(List.of(List.of("a", "b")));
    assertEquals(new CompiledQuery.BatchGet(List.of("user/a", "user/b")), CouchQueryCompiler.compile(USER, batch));
  }

  @Test
  void emptyTreeCompilesToRangeScan() {
    assertEquals(new CompiledQuery.RangeScan("user", "user/{}", 10, 0, false),
        CouchQueryCompiler.compile(USER, new Query().withLimit(10)));
    assertEquals(new CompiledQuery.RangeScan("user", "user/{}", 100, 0, false),
        CouchQueryCompiler.compile(USER, new Query()));
    assertEquals(new CompiledQuery.RangeScan("user", "user/{}", 100, 0, false),
        CouchQueryCompiler.compile(USER, Query.of(and())));
  }

  @Test
  void descendingScanSwapsBounds() {
    Query desc = new Query().withLimit(5).withSkip(2).withSort(List.of(SortField.desc("_id")));
    assertEquals(new CompiledQuery.RangeScan("user/{}", "user", 5, 2, true), CouchQueryCompiler.compile(USER, desc));

    Query asc = new Query().withSort(List.of(SortField.asc("_id"), SortField.desc("age")));
    CompiledQuery.RangeScan scan = (CompiledQuery.RangeScan) CouchQueryCompiler.compile(USER, asc);
    assertEquals("user", scan.startKey());
    assertEquals("user/{}", scan.endKey());
    assertFalse(scan.descending());
  }

  @Test
  void operatorsTranslateToMango() {
    Query q = Query.and(gt("age", 18), le("age", 65), ne("role", "guest"), in("role", List.of("admin", "owner")));
    CompiledQuery.Selector s = (CompiledQuery.Selector) CouchQueryCompiler.compile(USER, q);

    Map<String, Object> age = new LinkedHashMap<>();
    age.put("$gt", 18);
    age.put("$lte", 65);
    Map<String, Object> role = new LinkedHashMap<>();
    role.put("$ne", "guest");
    role.put("$in", List.of("admin", "owner"));
    assertEquals(Map.of("type", "user", "age", age, "role", role), s.selector());
  }

  @Test
  void conflictingConjunctsFallBackToExplicitAnd() {
    Query q = Query.and(eq("role", "admin"), eq("role", "owner"), gt("age", 1), gt("age", 2));
    CompiledQuery.Selector s = (CompiledQuery.Selector) CouchQueryCompiler.compile(USER, q);

    assertEquals("admin", s.selector().get("role"));
    assertEquals(Map.of("$gt", 1), s.selector().get("age"));
    assertEquals(List.of(Map.of("role", "owner"), Map.of("age", Map.of("$gt", 2))), s.selector().get("$and"));
  }

  @Test
  void disjunctionWrapsChildrenInOr() {
    Query q = Query.and(eq("role", "admin"), or(eq("email", "a@b.com"), lt("age", 3)));
    CompiledQuery.Selector s = (CompiledQuery.Selector) CouchQueryCompiler.compile(USER, q);

    assertEquals(List.of(Map.of("email", "a@b.com"), Map.of("age", Map.of("$lt", 3))), s.selector().get("$or"));
    assertEquals("user", s.selector().get("type"));
  }

  @Test
  void filterOnTypeCannotEscapeTheNamespace() {
    CompiledQuery.Selector s = (CompiledQuery.Selector) CouchQueryCompiler.compile(USER, Query.of(eq("type", "org")));
    assertEquals("user", s.selector().get("type"));
    assertEquals(List.of(Map.of("type", "org")), s.selector().get("$and"));
  }

  @Test
  void primaryKeyInsideSelectorIsQualified() {
    Query q = Query.and(in("id", List.of(1, 2)), eq("role", "admin"));
    CompiledQuery.Selector s = (CompiledQuery.Selector) CouchQueryCompiler.compile(USER, q);
    assertEquals(Map.of("$in", List.of("user/1", "user/2")), s.selector().get("_id"));
    assertFalse(s.selector().containsKey("id"));
  }

  @Test
  void selectorOptionsCarryProjectionSortAndPaging() {
    Query q = Query.of(eq("role", "admin"))
        .withProjection(List.of("email", "age"))
        .withSort(List.of(SortField.desc("age")))
        .withLimit(20)
        .withSkip(40);
    CompiledQuery.Selector s = (CompiledQuery.Selector) CouchQueryCompiler.compile(USER, q);

    Map<String, Object> body = s.toRequest();
    assertEquals(List.of("selector", "fields", "sort", "limit", "skip"), List.copyOf(body.keySet()));
    assertEquals(List.of("email", "age"), body.get("fields"));
    assertEquals(List.of(Map.of("age", "desc")), body.get("sort"));
    assertEquals(20, body.get("limit"));
    assertEquals(40, body.get("skip"));
  }

  @Test
  void compileIsDeterministic() {
    Query q = Query.and(
            eq("email", QueryValues.placeholder(0)),
            or(gt("age", 18), in("role", List.of("a", "b"))),
            ne("role", "c"))
        .withParams(List.of("a@b.com"))
        .withSort(List.of(SortField.asc("email")));

    CompiledQuery first = CouchQueryCompiler.compile(USER, q);
    for (int i = 0; i < 5; i++) {
      CompiledQuery again = CouchQueryCompiler.compile(USER, q);
      assertEquals(first, again);
      assertEquals(first.toString(), again.toString());
    }
  }

  @Test
  void placeholderOutOfRangeIsValidationError() {
    Query q = Query.of(eq("email", QueryValues.placeholder(2))).withParams(List.of("x"));
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> CouchQueryCompiler.compile(USER, q));
    assertEquals(ValidationError.Reason.PLACEHOLDER_OUT_OF_RANGE, ex.reason());
  }

  @Test
  void likeIsUnsupported() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> CouchQueryCompiler.compile(USER, Query.of(like("email", "%@b.com"))));
    assertEquals(ValidationError.Reason.UNSUPPORTED_OPERATOR, ex.reason());
  }

  @Test
  void malformedPredicatesAreValidationErrors() {
    assertEquals(ValidationError.Reason.MALFORMED_PREDICATE, reasonOf(Query.of(in("role", List.of()))));
    assertEquals(ValidationError.Reason.MALFORMED_PREDICATE, reasonOf(Query.of(Condition.of("role", Operator.IN, "admin"))));
    assertEquals(ValidationError.Reason.MALFORMED_PREDICATE, reasonOf(Query.of(gt("age", null))));
    assertEquals(ValidationError.Reason.MALFORMED_PREDICATE, reasonOf(Query.of(eq("id", null))));
  }

  private static ValidationError.Reason reasonOf(Query q) {
    return assertThrows(QueryValidationException.class, () -> CouchQueryCompiler.compile(USER, q)).reason();
  }
}
