package io.intellixity.couchlink.persistence.mapping;

import java.util.*;

/**
 * Projected result: row count plus rows, each row holding one value per projected field.
 */
public record RowSet(long count, List<List<Object>> rows) {
  public static final RowSet EMPTY = new RowSet(0, List.of());

  public RowSet {
    List<List<Object>> copy = new ArrayList<>();
    if (rows != null) {
      // rows may carry nulls for absent fields, so no List.copyOf here
      for (List<Object> r : rows) copy.add(Collections.unmodifiableList(new ArrayList<>(r)));
    }
    rows = Collections.unmodifiableList(copy);
  }

  public static RowSet of(List<List<Object>> rows) {
    return new RowSet(rows.size(), rows);
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }
}
