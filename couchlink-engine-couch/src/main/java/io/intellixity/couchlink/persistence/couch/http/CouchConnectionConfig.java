package io.intellixity.couchlink.persistence.couch.http;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection settings for one CouchDB database.
 *
 * @param username null for anonymous access; otherwise sent as HTTP Basic credentials with {@code password}
 * @param requestTimeout upper bound for every single request (also used as connect timeout)
 */
public record CouchConnectionConfig(
    String protocol,
    String hostname,
    int port,
    String database,
    String username,
    String password,
    Duration requestTimeout
) {
  public static final String PREFIX = "couchlink.";
  public static final String DEFAULT_RESOURCE = "couchlink.properties";
  public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(5_000);

  public CouchConnectionConfig {
    protocol = (protocol == null || protocol.isBlank()) ? "http" : protocol;
    hostname = (hostname == null || hostname.isBlank()) ? "localhost" : hostname;
    if (port <= 0 || port > 65_535) throw new IllegalArgumentException("port out of range: " + port);
    if (database == null || database.isBlank()) throw new IllegalArgumentException("database is required");
    requestTimeout = (requestTimeout == null) ? DEFAULT_TIMEOUT : requestTimeout;
    if (requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("requestTimeout must be > 0");
    }
  }

  public static CouchConnectionConfig of(String hostname, int port, String database) {
    return new CouchConnectionConfig("http", hostname, port, database, null, null, DEFAULT_TIMEOUT);
  }

  /**
   * Reads {@code couchlink.protocol}, {@code couchlink.hostname}, {@code couchlink.port},
   * {@code couchlink.database}, {@code couchlink.username}, {@code couchlink.password} and
   * {@code couchlink.timeout-ms}.
   */
  public static CouchConnectionConfig fromProperties(Properties props) {
    Objects.requireNonNull(props, "props");
    String port = props.getProperty(PREFIX + "port", "5984").trim();
    String timeout = props.getProperty(PREFIX + "timeout-ms");
    try {
      return new CouchConnectionConfig(
          props.getProperty(PREFIX + "protocol"),
          props.getProperty(PREFIX + "hostname"),
          Integer.parseInt(port),
          props.getProperty(PREFIX + "database"),
          props.getProperty(PREFIX + "username"),
          props.getProperty(PREFIX + "password"),
          (timeout == null || timeout.isBlank()) ? null : Duration.ofMillis(Long.parseLong(timeout.trim())));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid numeric couchlink setting: " + e.getMessage(), e);
    }
  }

  /** Loads a classpath properties resource, e.g. {@link #DEFAULT_RESOURCE}. */
  public static CouchConnectionConfig load(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = CouchConnectionConfig.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(Objects.requireNonNull(resource, "resource"))) {
      if (in == null) throw new IllegalArgumentException("Resource not found: " + resource);
      Properties props = new Properties();
      props.load(in);
      return fromProperties(props);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + resource, e);
    }
  }

  /** {@code <protocol>://<hostname>:<port>/<database>}, without a trailing slash. */
  public URI baseUri() {
    return URI.create(protocol + "://" + hostname + ":" + port + "/" + database);
  }

  public boolean hasCredentials() {
    return username != null && !username.isBlank();
  }

  @Override
  public String toString() {
    return "CouchConnectionConfig[" + baseUri() + ", user=" + (hasCredentials() ? username : "-")
        + ", timeout=" + requestTimeout + "]";
  }
}
