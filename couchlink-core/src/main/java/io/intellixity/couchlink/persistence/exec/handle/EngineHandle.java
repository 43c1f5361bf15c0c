package io.intellixity.couchlink.persistence.exec.handle;

/**
 * Caller-held runtime handle for a backend store.\n
 *
 * Engines never look handles up from ambient state; each engine instance is bound to the handle it is
 * constructed with.\n
 */
public interface EngineHandle<TClient> {
  /** Unique identifier for this handle (useful for logging). */
  String id();

  /** Native client used by an engine (document store, HTTP client, etc.). */
  TClient client();

  /** Namespace (database) for this handle. */
  String namespace();
}
