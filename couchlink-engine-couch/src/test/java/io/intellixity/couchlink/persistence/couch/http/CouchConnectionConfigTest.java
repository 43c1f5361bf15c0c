package io.intellixity.couchlink.persistence.couch.http;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class CouchConnectionConfigTest {
  @Test
  void loadsClasspathProperties() {
    CouchConnectionConfig c = CouchConnectionConfig.load(CouchConnectionConfig.DEFAULT_RESOURCE);

    assertEquals(URI.create("http://couch.internal:6984/orders"), c.baseUri());
    assertTrue(c.hasCredentials());
    assertEquals("svc", c.username());
    assertEquals(Duration.ofMillis(2500), c.requestTimeout());
  }

  @Test
  void toStringNeverShowsThePassword() {
    String s = CouchConnectionConfig.load(CouchConnectionConfig.DEFAULT_RESOURCE).toString();
    assertFalse(s.contains("s3cret"));
    assertTrue(s.contains("user=svc"));
  }

  @Test
  void defaultsApplyToMissingKeys() {
    Properties p = new Properties();
    p.setProperty("couchlink.database", "app");

    CouchConnectionConfig c = CouchConnectionConfig.fromProperties(p);

    assertEquals(URI.create("http://localhost:5984/app"), c.baseUri());
    assertFalse(c.hasCredentials());
    assertEquals(CouchConnectionConfig.DEFAULT_TIMEOUT, c.requestTimeout());
  }

  @Test
  void invalidSettingsAreRejected() {
    Properties noDb = new Properties();
    assertThrows(IllegalArgumentException.class, () -> CouchConnectionConfig.fromProperties(noDb));

    Properties badPort = new Properties();
    badPort.setProperty("couchlink.database", "app");
    badPort.setProperty("couchlink.port", "eighty");
    assertThrows(IllegalArgumentException.class, () -> CouchConnectionConfig.fromProperties(badPort));

    assertThrows(IllegalArgumentException.class, () -> CouchConnectionConfig.of("localhost", 70_000, "app"));
    assertThrows(IllegalArgumentException.class, () -> CouchConnectionConfig.load("missing.properties"));
  }
}
