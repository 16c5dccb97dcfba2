package gov.lbl.als.ingest.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import gov.lbl.als.ingest.application.port.RegistryException;
import gov.lbl.als.ingest.logging.Logs;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Small JSON-over-HTTP helper shared by the registry adapters.
 * <p><strong>Error mapping:</strong> timeouts, connection failures, HTTP 429 and 5xx answers become
 * transient {@link RegistryException}s; other non-2xx answers become rejections carrying the status.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the underlying {@link HttpClient} is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class JsonHttpClient {
  private static final Logger log = LoggerFactory.getLogger(JsonHttpClient.class);
  private static final int MAX_BODY_IN_MESSAGE = 300;

  private final HttpClient http;
  private final ObjectMapper mapper;
  private final String baseUrl;
  private final Duration timeout;

  /**
   * Creates a client.
   *
   * @param baseUrl registry base URL; a trailing slash is ignored
   * @param timeout per-request timeout, also used as connect timeout
   * @param mapper JSON mapper
   */
  public JsonHttpClient(String baseUrl, Duration timeout, ObjectMapper mapper) {
    this(HttpClient.newBuilder().connectTimeout(timeout).build(), baseUrl, timeout, mapper);
  }

  JsonHttpClient(HttpClient http, String baseUrl, Duration timeout, ObjectMapper mapper) {
    this.http = Objects.requireNonNull(http, "http");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    String base = Objects.requireNonNull(baseUrl, "baseUrl").trim();
    this.baseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
  }

  public ObjectMapper mapper() {
    return mapper;
  }

  public String baseUrl() {
    return baseUrl;
  }

  /**
   * Sends a request.
   *
   * @param method HTTP method
   * @param path path below the base URL, starting with {@code /}; may carry a query
   * @param body JSON body, or {@code null}
   * @param headers extra headers, for example authorization
   * @return parsed response body; {@link MissingNode} when empty
   * @throws RegistryException on transport failure or non-2xx status
   */
  public JsonNode send(String method, String path, Object body, Map<String, String> headers)
      throws RegistryException {
    URI uri = URI.create(baseUrl + path);
    HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
        .timeout(timeout)
        .header("Accept", "application/json");
    headers.forEach(builder::header);
    if (body == null) {
      builder.method(method, HttpRequest.BodyPublishers.noBody());
    } else {
      builder.header("Content-Type", "application/json");
      builder.method(method, HttpRequest.BodyPublishers.ofByteArray(serialize(body)));
    }

    HttpResponse<String> response;
    try {
      response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw RegistryException.unavailable(method + " " + uri + " interrupted", e);
    } catch (IOException e) {
      // HttpTimeoutException and ConnectException are IOExceptions
      throw RegistryException.unavailable(method + " " + uri + " failed: " + e, e);
    }

    int status = response.statusCode();
    log.debug("{} {} -> {}", method, uri, status);
    if (status < 200 || status >= 300) {
      String responseBody = response.body() == null ? "" : response.body();
      String message = method + " " + uri + " returned " + status + ": "
          + Logs.truncate(responseBody, MAX_BODY_IN_MESSAGE);
      boolean transientStatus = status == 429 || status >= 500;
      throw new RegistryException(message, transientStatus, status);
    }
    String text = response.body();
    if (text == null || text.isBlank()) {
      return MissingNode.getInstance();
    }
    try {
      return mapper.readTree(text);
    } catch (JsonProcessingException e) {
      throw new RegistryException(method + " " + uri + " returned invalid JSON: " + e.getOriginalMessage(),
          false, e);
    }
  }

  /**
   * Builds a query string.
   *
   * @param params parameter names and values, in order; {@code null} values are skipped
   * @return {@code ?a=b&c=d}, or empty when no parameter has a value
   */
  public static String query(Map<String, String> params) {
    StringJoiner joiner = new StringJoiner("&", "?", "");
    joiner.setEmptyValue("");
    params.forEach((key, value) -> {
      if (value != null) {
        joiner.add(encode(key) + "=" + encode(value));
      }
    });
    return joiner.toString();
  }

  public static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }

  private byte[] serialize(Object body) throws RegistryException {
    try {
      return mapper.writeValueAsBytes(body);
    } catch (JsonProcessingException e) {
      throw new RegistryException("Request body could not be serialized: " + e.getOriginalMessage(),
          false, e);
    }
  }
}
