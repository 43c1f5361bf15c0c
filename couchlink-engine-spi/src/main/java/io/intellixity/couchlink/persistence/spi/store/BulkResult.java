package io.intellixity.couchlink.persistence.spi.store;

/** One entry of a bulk write response: either {@code rev} or {@code error}/{@code reason} is set. */
public record BulkResult(String id, String rev, String error, String reason) {
  public static BulkResult ok(String id, String rev) {
    return new BulkResult(id, rev, null, null);
  }

  public static BulkResult failed(String id, String error, String reason) {
    return new BulkResult(id, null, error, reason);
  }

  public boolean ok() {
    return error == null;
  }
}
