package io.intellixity.couchlink.persistence.couch;

import io.intellixity.couchlink.persistence.exec.handle.EngineHandle;
import io.intellixity.couchlink.persistence.spi.store.DocumentStore;

import java.util.Objects;

/** CouchDB engine handle (resolved by application code). */
public final class CouchHandle implements EngineHandle<DocumentStore> {
  private final String id;
  private final DocumentStore store;
  private final String database;

  public CouchHandle(String id, DocumentStore store, String database) {
    this.id = Objects.requireNonNull(id, "id");
    this.store = Objects.requireNonNull(store, "store");
    this.database = Objects.requireNonNull(database, "database");
  }

  @Override public String id() { return id; }
  @Override public DocumentStore client() { return store; }
  @Override public String namespace() { return database; }

  public String database() { return database; }
}
