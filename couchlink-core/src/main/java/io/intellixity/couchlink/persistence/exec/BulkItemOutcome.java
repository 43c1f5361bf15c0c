package io.intellixity.couchlink.persistence.exec;

import java.util.*;

/**
 * Per-document outcome of a bulk insert. Failures are reported here, never thrown, and never affect the
 * sibling documents of the same batch.
 *
 * @param index position of the document in the submitted batch
 * @param id qualified document id
 * @param rev assigned revision, null on failure
 * @param error store error code, null on success
 * @param reason store error reason, null on success
 * @param returning requested return fields; absent fields map to null
 */
public record BulkItemOutcome(
    int index,
    String id,
    String rev,
    String error,
    String reason,
    Map<String, Object> returning
) {
  public BulkItemOutcome {
    returning = (returning == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(returning));
  }

  public boolean ok() {
    return error == null;
  }
}
