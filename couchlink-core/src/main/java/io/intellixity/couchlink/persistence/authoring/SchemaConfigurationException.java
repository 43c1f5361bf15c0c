package io.intellixity.couchlink.persistence.authoring;

/**
 * Schema authoring bug: ambiguous or partial constraint declaration, unknown field type, etc.
 * Fatal; never retried.
 */
public final class SchemaConfigurationException extends RuntimeException {
  public SchemaConfigurationException(String message) {
    super(message);
  }
}
