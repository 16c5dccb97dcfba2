package gov.lbl.als.ingest.testutil;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Loopback HTTP server answering {@code METHOD path?query} keys with canned responses. Unmatched
 * requests get a 404. Every request is recorded.
 */
public final class StubHttpServer implements AutoCloseable {
  /** One recorded request. */
  public record Request(String method, String pathAndQuery, Map<String, List<String>> headers, String body) {
    public String header(String name) {
      for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
        if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
          return entry.getValue().get(0);
        }
      }
      return null;
    }
  }

  private record Response(int status, String body) {}

  private final HttpServer server;
  private final Map<String, Deque<Response>> responses = new ConcurrentHashMap<>();
  public final List<Request> requests = new CopyOnWriteArrayList<>();

  public StubHttpServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
    server.createContext("/", this::handle);
    server.start();
  }

  public String baseUrl() {
    return "http://127.0.0.1:" + server.getAddress().getPort() + "/api";
  }

  /**
   * Queues a response. Responses for the same key are served in order; the last one repeats.
   *
   * @param key {@code METHOD /path?query}, relative to {@link #baseUrl()}
   */
  public StubHttpServer respond(String key, int status, String body) {
    responses.computeIfAbsent(key, k -> new ArrayDeque<>()).add(new Response(status, body));
    return this;
  }

  private void handle(HttpExchange exchange) throws IOException {
    String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    String raw = exchange.getRequestURI().getRawPath();
    String path = raw.startsWith("/api") ? raw.substring(4) : raw;
    String query = exchange.getRequestURI().getRawQuery();
    String pathAndQuery = query == null ? path : path + "?" + query;
    String method = exchange.getRequestMethod();
    requests.add(new Request(method, pathAndQuery, Map.copyOf(exchange.getRequestHeaders()), body));

    Response response = next(method + " " + pathAndQuery);
    byte[] bytes = response.body().getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(response.status(), bytes.length == 0 ? -1 : bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }

  private Response next(String key) {
    Deque<Response> queue = responses.get(key);
    if (queue == null || queue.isEmpty()) {
      return new Response(404, "{\"detail\":\"not found\"}");
    }
    synchronized (queue) {
      return queue.size() > 1 ? queue.poll() : queue.peek();
    }
  }

  @Override
  public void close() {
    server.stop(0);
  }
}
