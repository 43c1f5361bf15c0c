package io.intellixity.couchlink.persistence.mapping;

import java.util.*;

/**
 * Ordered projection: field names, each paired with the static default emitted when a document lacks the
 * field and no semantic type is known.
 */
public final class FieldSet {
  private final List<String> names;
  private final Map<String, Object> defaults;

  private FieldSet(List<String> names, Map<String, Object> defaults) {
    if (new HashSet<>(names).size() != names.size()) {
      throw new IllegalArgumentException("Duplicate projected field in " + names);
    }
    this.names = List.copyOf(names);
    this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
  }

  public static FieldSet of(String... names) {
    return new FieldSet(List.of(names), Map.of());
  }

  public static FieldSet of(List<String> names) {
    return new FieldSet(names, Map.of());
  }

  /** Fields in map iteration order; map values are the static defaults (may be null). */
  public static FieldSet withDefaults(LinkedHashMap<String, Object> fieldsWithDefaults) {
    return new FieldSet(new ArrayList<>(fieldsWithDefaults.keySet()), fieldsWithDefaults);
  }

  public List<String> names() { return names; }
  public int size() { return names.size(); }

  public Object defaultFor(String field) {
    return defaults.get(field);
  }

  @Override
  public String toString() {
    return names.toString();
  }
}
