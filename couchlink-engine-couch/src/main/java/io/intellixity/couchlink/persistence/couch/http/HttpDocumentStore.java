package io.intellixity.couchlink.persistence.couch.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.couchlink.persistence.exec.ViewOptions;
import io.intellixity.couchlink.persistence.naming.Namespacer;
import io.intellixity.couchlink.persistence.spi.store.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * {@link DocumentStore} over the CouchDB HTTP API using {@link HttpClient} and Jackson.
 * <p>
 * Ids are percent-encoded here and nowhere else. A 404 naming a missing or deleted document is absence; every other
 * non-2xx answer, timeout or transport failure raises {@link StoreException}. Requests are never retried.
 */
public final class HttpDocumentStore implements DocumentStore {
  private static final Logger log = LoggerFactory.getLogger(HttpDocumentStore.class);

  private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};
  private static final TypeReference<List<Map<String, Object>>> LIST_OF_MAPS = new TypeReference<>() {};
  private static final String JSON = "application/json";

  private final CouchConnectionConfig config;
  private final HttpClient client;
  private final ObjectMapper mapper;
  private final String authorization;

  public HttpDocumentStore(CouchConnectionConfig config) {
    this(config,
        HttpClient.newBuilder().connectTimeout(Objects.requireNonNull(config, "config").requestTimeout()).build(),
        new ObjectMapper());
  }

  public HttpDocumentStore(CouchConnectionConfig config, HttpClient client, ObjectMapper mapper) {
    this.config = Objects.requireNonNull(config, "config");
    this.client = Objects.requireNonNull(client, "client");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.authorization = config.hasCredentials()
        ? "Basic " + Base64.getEncoder().encodeToString(
            (config.username() + ":" + (config.password() == null ? "" : config.password())).getBytes(StandardCharsets.UTF_8))
        : null;
  }

  public CouchConnectionConfig config() {
    return config;
  }

  @Override
  public Optional<Map<String, Object>> get(String id) {
    HttpResponse<String> res = send("GET", docPath(id), null);
    if (res.statusCode() == 404) {
      Map<String, Object> payload = errorPayload(res);
      if (StoreException.isMissingDocument(payload)) return Optional.empty();
      throw failure(res.statusCode(), payload);
    }
    return Optional.of(readMap(requireSuccess(res)));
  }

  @Override
  public PutResult put(String id, Map<String, Object> body, String rev) {
    Map<String, Object> doc = new LinkedHashMap<>(Objects.requireNonNull(body, "body"));
    doc.remove("_id");
    if (rev != null) doc.put("_rev", rev);
    else doc.remove("_rev");
    HttpResponse<String> res = send("PUT", docPath(id), doc);
    return putResult(id, readMap(requireSuccess(res)));
  }

  @Override
  public List<BulkResult> bulkPut(List<Map<String, Object>> docs) {
    HttpResponse<String> res = send("POST", "/_bulk_docs", Map.of("docs", docs));
    List<Map<String, Object>> items = readList(requireSuccess(res));
    List<BulkResult> out = new ArrayList<>(items.size());
    for (Map<String, Object> item : items) {
      String id = text(item.get("id"));
      if (item.get("error") != null) out.add(BulkResult.failed(id, text(item.get("error")), text(item.get("reason"))));
      else out.add(BulkResult.ok(id, text(item.get("rev"))));
    }
    return out;
  }

  @Override
  public Map<String, Object> allDocs(List<String> ids, boolean includeDocs) {
    String path = "/_all_docs" + (includeDocs ? "?include_docs=true" : "");
    HttpResponse<String> res = send("POST", path, Map.of("keys", ids));
    return readMap(requireSuccess(res));
  }

  @Override
  public Map<String, Object> find(Map<String, Object> request) {
    HttpResponse<String> res = send("POST", "/_find", Objects.requireNonNull(request, "request"));
    return readMap(requireSuccess(res));
  }

  @Override
  public Map<String, Object> rangeScan(String startKey, String endKey, Integer limit, Integer skip,
                                       boolean descending, boolean includeDocs) {
    StringBuilder q = new StringBuilder("/_all_docs?startkey=").append(jsonParam(startKey))
        .append("&endkey=").append(jsonParam(endKey));
    if (includeDocs) q.append("&include_docs=true");
    if (limit != null) q.append("&limit=").append(limit);
    if (skip != null && skip > 0) q.append("&skip=").append(skip);
    if (descending) q.append("&descending=true");
    HttpResponse<String> res = send("GET", q.toString(), null);
    return readMap(requireSuccess(res));
  }

  @Override
  public Map<String, Object> view(String design, String view, ViewOptions options) {
    ViewOptions o = (options == null) ? ViewOptions.DEFAULTS : options;
    StringBuilder q = new StringBuilder("/_design/").append(Namespacer.encode(Objects.requireNonNull(design, "design")))
        .append("/_view/").append(Namespacer.encode(Objects.requireNonNull(view, "view")));
    List<String> params = new ArrayList<>();
    if (o.key() != null) params.add("key=" + jsonParam(o.key()));
    if (o.startKey() != null) params.add("startkey=" + jsonParam(o.startKey()));
    if (o.endKey() != null) params.add("endkey=" + jsonParam(o.endKey()));
    if (o.includeDocs()) params.add("include_docs=true");
    if (o.limit() != null) params.add("limit=" + o.limit());
    if (o.skip() != null && o.skip() > 0) params.add("skip=" + o.skip());
    if (o.descending()) params.add("descending=true");
    if (!params.isEmpty()) q.append('?').append(String.join("&", params));
    HttpResponse<String> res = send("GET", q.toString(), null);
    return readMap(requireSuccess(res));
  }

  @Override
  public PutResult delete(String id, String rev) {
    String path = docPath(id) + (rev == null ? "" : "?rev=" + Namespacer.encode(rev));
    HttpResponse<String> res = send("DELETE", path, null);
    if (res.statusCode() == 404) {
      Map<String, Object> payload = errorPayload(res);
      if (StoreException.isMissingDocument(payload)) throw new DocumentNotFoundException(id);
      throw failure(res.statusCode(), payload);
    }
    return putResult(id, readMap(requireSuccess(res)));
  }

  private static String docPath(String id) {
    return "/" + Namespacer.encode(Objects.requireNonNull(id, "id"));
  }

  /** View and range keys are JSON values, so strings travel quoted. */
  private String jsonParam(Object key) {
    try {
      return Namespacer.encode(mapper.writeValueAsString(key));
    } catch (JsonProcessingException e) {
      throw new StoreException("bad_request", "cannot encode key", e);
    }
  }

  private HttpResponse<String> send(String method, String pathAndQuery, Object body) {
    URI uri = URI.create(config.baseUri() + pathAndQuery);
    HttpRequest.Builder b = HttpRequest.newBuilder(uri)
        .timeout(config.requestTimeout())
        .header("Accept", JSON);
    if (authorization != null) b.header("Authorization", authorization);
    if (body == null) {
      b.method(method, HttpRequest.BodyPublishers.noBody());
    } else {
      b.header("Content-Type", JSON);
      b.method(method, HttpRequest.BodyPublishers.ofString(write(body), StandardCharsets.UTF_8));
    }

    long start = System.nanoTime();
    try {
      HttpResponse<String> res = client.send(b.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
      debugDone(method, pathAndQuery, res.statusCode(), System.nanoTime() - start);
      return res;
    } catch (HttpTimeoutException e) {
      throw new StoreException("timeout", method + " timed out after " + config.requestTimeout().toMillis() + "ms", e);
    } catch (IOException e) {
      throw new StoreException("transport_error", String.valueOf(e.getMessage()), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreException("interrupted", method + " interrupted", e);
    }
  }

  private String requireSuccess(HttpResponse<String> res) {
    int status = res.statusCode();
    if (status >= 200 && status < 300) return res.body();
    throw failure(status, errorPayload(res));
  }

  private Map<String, Object> errorPayload(HttpResponse<String> res) {
    try {
      return (res.body() == null || res.body().isBlank()) ? Map.of() : mapper.readValue(res.body(), MAP);
    } catch (JsonProcessingException e) {
      throw new StoreException(res.statusCode(), "http_" + res.statusCode(), "unreadable error body", e);
    }
  }

  private static StoreException failure(int status, Map<String, Object> payload) {
    if (payload.get("error") == null) return new StoreException(status, "http_" + status, text(payload.get("reason")));
    return StoreException.fromPayload(status, payload);
  }

  private static PutResult putResult(String requestedId, Map<String, Object> payload) {
    String id = text(payload.get("id"));
    return new PutResult(id == null ? requestedId : id, text(payload.get("rev")));
  }

  private Map<String, Object> readMap(String body) {
    try {
      return mapper.readValue(body, MAP);
    } catch (JsonProcessingException e) {
      throw new StoreException("bad_response", "invalid JSON response", e);
    }
  }

  private List<Map<String, Object>> readList(String body) {
    try {
      return mapper.readValue(body, LIST_OF_MAPS);
    } catch (JsonProcessingException e) {
      throw new StoreException("bad_response", "invalid JSON response", e);
    }
  }

  private String write(Object body) {
    try {
      return mapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new StoreException("bad_request", "cannot serialize request body", e);
    }
  }

  private static String text(Object v) {
    return (v == null) ? null : String.valueOf(v);
  }

  private static void debugDone(String method, String pathAndQuery, int status, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("couchlink.http method={} endpoint={} status={} durationMs={}",
        method, endpoint(pathAndQuery), status, durationNanos / 1_000_000.0);
  }

  /** Endpoint name without ids or keys: marker ids embed field values. Design and view names are kept. */
  static String endpoint(String pathAndQuery) {
    String path = pathAndQuery;
    int q = path.indexOf('?');
    if (q >= 0) path = path.substring(0, q);
    return path.startsWith("/_") ? path : "/{doc}";
  }
}
