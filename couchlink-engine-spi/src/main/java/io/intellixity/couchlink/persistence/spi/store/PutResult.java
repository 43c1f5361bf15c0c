package io.intellixity.couchlink.persistence.spi.store;

import java.util.Objects;

/** Store-assigned id and revision of a successful write. */
public record PutResult(String id, String rev) {
  public PutResult {
    Objects.requireNonNull(id, "id");
  }
}
