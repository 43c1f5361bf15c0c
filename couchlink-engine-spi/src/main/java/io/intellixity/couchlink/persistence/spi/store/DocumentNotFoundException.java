package io.intellixity.couchlink.persistence.spi.store;

/** The target of an update or delete does not exist. Lookups report absence with an empty result instead. */
public final class DocumentNotFoundException extends StoreException {
  private final String id;

  public DocumentNotFoundException(String id) {
    super(404, "not_found", "missing: " + id);
    this.id = id;
  }

  public String id() {
    return id;
  }
}
