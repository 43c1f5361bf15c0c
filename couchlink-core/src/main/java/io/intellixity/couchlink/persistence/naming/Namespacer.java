package io.intellixity.couchlink.persistence.naming;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Namespace derivation and {@code "<namespace>/<local_id>"} id composition.
 * <p>
 * Everything here works on unencoded ids; {@link #encode(String)} is applied only when an id crosses the
 * store boundary.
 */
public final class Namespacer {
  public static final char SEPARATOR = '/';

  private Namespacer() {}

  /**
   * Singular, lowercase, underscored collection name for a type name:
   * {@code UserProfiles -> user_profile}, {@code com.acme.Category -> category}.
   */
  public static String namespace(String typeName) {
    if (typeName == null || typeName.isBlank()) throw new IllegalArgumentException("typeName is required");
    String simple = typeName.trim();
    int dot = simple.lastIndexOf('.');
    if (dot >= 0) simple = simple.substring(dot + 1);

    String underscored = underscore(simple);
    int cut = underscored.lastIndexOf('_');
    String head = underscored.substring(0, cut + 1);
    String last = underscored.substring(cut + 1);
    return head + singularize(last);
  }

  /** Idempotent: an id already carrying {@code "<namespace>/"} is returned unchanged. */
  public static String qualify(String namespace, String localId) {
    Objects.requireNonNull(namespace, "namespace");
    if (localId == null || localId.isEmpty()) throw new IllegalArgumentException("localId is required");
    String prefix = namespace + SEPARATOR;
    return localId.startsWith(prefix) ? localId : prefix + localId;
  }

  /** Strips a single leading {@code "<segment>/"} if present. */
  public static String unqualify(String id) {
    if (id == null) return null;
    int slash = id.indexOf(SEPARATOR);
    return (slash > 0) ? id.substring(slash + 1) : id;
  }

  /** Strips {@code "<namespace>/"} only when the id carries that exact namespace. */
  public static String unqualify(String namespace, String id) {
    if (id == null) return null;
    String prefix = Objects.requireNonNull(namespace, "namespace") + SEPARATOR;
    return id.startsWith(prefix) ? id.substring(prefix.length()) : id;
  }

  /** Namespace segment of a qualified id, or null when the id is not qualified. */
  public static String namespaceOf(String id) {
    if (id == null) return null;
    int slash = id.indexOf(SEPARATOR);
    return (slash > 0) ? id.substring(0, slash) : null;
  }

  /** Percent-encoding of a full id (the {@code /} included) for use as a single store URL path segment. */
  public static String encode(String id) {
    // form encoding turns spaces into '+', which a URL path would read literally
    return URLEncoder.encode(Objects.requireNonNull(id, "id"), StandardCharsets.UTF_8).replace("+", "%20");
  }

  public static String decode(String encoded) {
    return URLDecoder.decode(Objects.requireNonNull(encoded, "encoded"), StandardCharsets.UTF_8);
  }

  static String underscore(String s) {
    StringBuilder out = new StringBuilder(s.length() + 4);
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (ch == '-' || ch == ' ') {
        out.append('_');
        continue;
      }
      if (Character.isUpperCase(ch) && i > 0) {
        char prev = s.charAt(i - 1);
        boolean nextLower = i + 1 < s.length() && Character.isLowerCase(s.charAt(i + 1));
        if (Character.isLowerCase(prev) || Character.isDigit(prev) || (Character.isUpperCase(prev) && nextLower)) {
          if (out.length() > 0 && out.charAt(out.length() - 1) != '_') out.append('_');
        }
      }
      out.append(Character.toLowerCase(ch));
    }
    return out.toString().toLowerCase(Locale.ROOT);
  }

  static String singularize(String word) {
    if (word.length() < 3) return word;
    if (word.endsWith("ies") && word.length() > 3) return word.substring(0, word.length() - 3) + "y";
    if (word.endsWith("sses") || word.endsWith("xes") || word.endsWith("ches") || word.endsWith("shes")) {
      return word.substring(0, word.length() - 2);
    }
    if (word.endsWith("ss") || word.endsWith("us") || word.endsWith("is")) return word;
    if (word.endsWith("s")) return word.substring(0, word.length() - 1);
    return word;
  }
}
