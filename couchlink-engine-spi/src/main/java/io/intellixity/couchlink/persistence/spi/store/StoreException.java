package io.intellixity.couchlink.persistence.spi.store;

import java.util.Map;

/**
 * Any backend failure other than plain absence: transport error, timeout, malformed response, error payload.
 * Never to be read as "document not found".
 */
public class StoreException extends RuntimeException {
  private final int status;
  private final String error;
  private final String reason;

  public StoreException(int status, String error, String reason) {
    super(error + " :: " + reason);
    this.status = status;
    this.error = error;
    this.reason = reason;
  }

  public StoreException(int status, String error, String reason, Throwable cause) {
    super(error + " :: " + reason, cause);
    this.status = status;
    this.error = error;
    this.reason = reason;
  }

  public StoreException(String error, String reason, Throwable cause) {
    super(error + " :: " + reason, cause);
    this.status = -1;
    this.error = error;
    this.reason = reason;
  }

  /** Builds an exception from a {@code {"error": ..., "reason": ...}} payload. */
  public static StoreException fromPayload(int status, Map<String, Object> payload) {
    Object error = (payload == null) ? null : payload.get("error");
    Object reason = (payload == null) ? null : payload.get("reason");
    return new StoreException(status,
        error == null ? "unknown_error" : String.valueOf(error),
        reason == null ? "" : String.valueOf(reason));
  }

  /**
   * True for error payloads such as {@code {"error": "not_found", "reason": "missing"}}. A map carrying
   * {@code _id} is a stored document, whatever other fields it has.
   */
  public static boolean isErrorPayload(Map<String, ?> payload) {
    return payload != null && payload.containsKey("error") && !payload.containsKey("_id")
        && !payload.containsKey("rows") && !payload.containsKey("docs");
  }

  /**
   * True only for a missing or deleted document. Other {@code not_found} payloads (e.g. a missing database)
   * are failures.
   */
  public static boolean isMissingDocument(Map<String, ?> payload) {
    if (payload == null || !"not_found".equals(payload.get("error"))) return false;
    Object reason = payload.get("reason");
    return "missing".equals(reason) || "deleted".equals(reason);
  }

  /** HTTP-like status, or -1 when the failure happened before a response was received. */
  public int status() { return status; }
  public String error() { return error; }
  public String reason() { return reason; }

  /** The store rejected a write because the revision did not match (or the document already exists). */
  public boolean isConflict() {
    return status == 409 || "conflict".equals(error);
  }
}
