package io.intellixity.couchlink.persistence.mapping;

import java.util.*;

public final class RowAdapters {
  private RowAdapters() {}

  public static RowAdapter fromMap(Map<String, Object> map) {
    return new MapRowAdapter(map == null ? Map.of() : map);
  }

  static Object getByPath(Map<String, Object> root, String path) {
    if (path == null || path.isBlank()) return root;
    // literal keys win over dotted traversal: schemaless documents may contain dots in key names
    if (root.containsKey(path)) return root.get(path);
    Object cur = root;
    for (String p : path.split("\\.")) {
      if (!(cur instanceof Map<?, ?> m)) return null;
      cur = m.get(p);
    }
    return cur;
  }

  static boolean hasPath(Map<String, Object> root, String path) {
    if (path == null || path.isBlank()) return true;
    if (root.containsKey(path)) return true;
    String[] parts = path.split("\\.");
    Object cur = root;
    for (String p : parts) {
      if (!(cur instanceof Map<?, ?> m) || !m.containsKey(p)) return false;
      cur = m.get(p);
    }
    return true;
  }

  static final class MapRowAdapter implements RowAdapter {
    private final Map<String, Object> root;

    MapRowAdapter(Map<String, Object> root) {
      this.root = root;
    }

    @Override public boolean has(String path) { return hasPath(root, path); }
    @Override public Object raw(String path) { return getByPath(root, path); }
  }
}
