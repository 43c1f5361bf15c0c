package io.intellixity.couchlink.persistence.mapping;

/** Read access to a raw document by (optionally dotted) field path. */
public interface RowAdapter {
  /** True when the path resolves to a present key, even if its value is null. */
  boolean has(String path);

  Object raw(String path);
}
