package io.intellixity.couchlink.persistence.mapping;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class RowAdaptersTest {
  @Test
  void dottedPathsTraverseNestedMaps() {
    RowAdapter row = RowAdapters.fromMap(Map.of("address", Map.of("city", "Pune")));
    assertTrue(row.has("address.city"));
    assertEquals("Pune", row.raw("address.city"));
    assertTrue(row.has("address"));
    assertFalse(row.has("address.zip"));
  }

  @Test
  void literalKeyWinsOverTraversal() {
    Map<String, Object> doc = new HashMap<>();
    doc.put("a.b", 1);
    doc.put("a", Map.of("b", 2));
    assertEquals(1, RowAdapters.fromMap(doc).raw("a.b"));
  }

  @Test
  void presentNullIsDistinctFromAbsent() {
    Map<String, Object> doc = new HashMap<>();
    doc.put("nick", null);
    RowAdapter row = RowAdapters.fromMap(doc);
    assertTrue(row.has("nick"));
    assertNull(row.raw("nick"));
    assertFalse(row.has("name"));
  }

  @Test
  void fieldSetKeepsOrderAndDefaults() {
    LinkedHashMap<String, Object> defaults = new LinkedHashMap<>();
    defaults.put("name", "anonymous");
    defaults.put("age", null);
    FieldSet fs = FieldSet.withDefaults(defaults);
    assertEquals(List.of("name", "age"), fs.names());
    assertEquals("anonymous", fs.defaultFor("name"));
    assertNull(fs.defaultFor("age"));
    assertThrows(IllegalArgumentException.class, () -> FieldSet.of("a", "a"));
  }

  @Test
  void rowSetKeepsNullCells() {
    List<Object> row = new ArrayList<>();
    row.add(null);
    row.add("x");
    RowSet rs = RowSet.of(List.of(row));
    assertEquals(1, rs.count());
    assertNull(rs.rows().get(0).get(0));
  }
}
