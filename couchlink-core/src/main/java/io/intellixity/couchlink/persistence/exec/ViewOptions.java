package io.intellixity.couchlink.persistence.exec;

/**
 * Read options of a design-document view query.
 *
 * @param key exact emitted key to match; null for no key filter
 * @param startKey lower bound of the key range (upper bound when descending); null for open
 * @param endKey upper bound of the key range (lower bound when descending); null for open
 * @param includeDocs when true every row carries the emitting document and rows are projected from it
 */
public record ViewOptions(
    Object key,
    Object startKey,
    Object endKey,
    Integer limit,
    Integer skip,
    boolean descending,
    boolean includeDocs
) {
  public static final ViewOptions DEFAULTS = new ViewOptions(null, null, null, null, null, false, false);

  public ViewOptions {
    if (limit != null && limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    if (skip != null && skip < 0) throw new IllegalArgumentException("skip must be >= 0");
    if (key != null && (startKey != null || endKey != null)) {
      throw new IllegalArgumentException("key and key range are mutually exclusive");
    }
  }

  public static ViewOptions forKey(Object key) {
    return DEFAULTS.withKey(key);
  }

  public ViewOptions withKey(Object key) {
    return new ViewOptions(key, startKey, endKey, limit, skip, descending, includeDocs);
  }

  public ViewOptions withRange(Object startKey, Object endKey) {
    return new ViewOptions(key, startKey, endKey, limit, skip, descending, includeDocs);
  }

  public ViewOptions withLimit(Integer limit) {
    return new ViewOptions(key, startKey, endKey, limit, skip, descending, includeDocs);
  }

  public ViewOptions withSkip(Integer skip) {
    return new ViewOptions(key, startKey, endKey, limit, skip, descending, includeDocs);
  }

  public ViewOptions withDescending(boolean descending) {
    return new ViewOptions(key, startKey, endKey, limit, skip, descending, includeDocs);
  }

  public ViewOptions withIncludeDocs(boolean includeDocs) {
    return new ViewOptions(key, startKey, endKey, limit, skip, descending, includeDocs);
  }
}
