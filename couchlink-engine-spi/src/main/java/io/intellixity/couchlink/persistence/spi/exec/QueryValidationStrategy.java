package io.intellixity.couchlink.persistence.spi.exec;

import io.intellixity.couchlink.persistence.authoring.SchemaDef;
import io.intellixity.couchlink.persistence.query.Query;

/**
 * SPI hook to validate queries before backend compilation.
 * <p>
 * Engines call this before compiling a query. Applications may plug in stricter rules; implementations
 * throw {@link io.intellixity.couchlink.persistence.query.QueryValidationException}.
 */
public interface QueryValidationStrategy {
  void validate(SchemaDef schema, Query query);
}
