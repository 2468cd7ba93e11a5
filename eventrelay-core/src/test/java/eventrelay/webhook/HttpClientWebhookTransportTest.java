package eventrelay.webhook;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpClientWebhookTransportTest {

  private HttpServer server;
  private ExecutorService executor;
  private final AtomicReference<byte[]> receivedBody = new AtomicReference<>();
  private final AtomicReference<String> receivedSignature = new AtomicReference<>();
  private final HttpClientWebhookTransport transport = new HttpClientWebhookTransport();

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/ok", exchange -> {
      try (InputStream in = exchange.getRequestBody()) {
        receivedBody.set(in.readAllBytes());
      }
      receivedSignature.set(exchange.getRequestHeaders().getFirst(WebhookSigner.SIGNATURE_HEADER));
      exchange.getResponseHeaders().add("X-Request-Id", "abc");
      reply(exchange, 204, "");
    });
    server.createContext("/unavailable", exchange -> reply(exchange, 503, "try later"));
    server.createContext("/moved", exchange -> {
      exchange.getResponseHeaders().add("Location", url("/ok"));
      reply(exchange, 302, "");
    });
    server.createContext("/slow", exchange -> {
      try {
        Thread.sleep(2_000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      reply(exchange, 200, "late");
    });
    executor = Executors.newCachedThreadPool();
    server.setExecutor(executor);
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
    executor.shutdownNow();
  }

  @Test
  void postsBodyAndHeaders() throws Exception {
    byte[] body = "{\"event_id\":\"e-1\"}".getBytes(StandardCharsets.UTF_8);
    WebhookResponse response = transport.post(new WebhookRequest(url("/ok"),
        Map.of("Content-Type", "application/json", WebhookSigner.SIGNATURE_HEADER, "sha256=00"),
        body, Duration.ofSeconds(5)));

    assertEquals(204, response.statusCode());
    assertTrue(response.successful());
    assertEquals("abc", header(response, "X-Request-Id"));
    assertArrayEquals(body, receivedBody.get());
    assertEquals("sha256=00", receivedSignature.get());
  }

  @Test
  void non2xxIsReturnedNotThrown() throws Exception {
    WebhookResponse response = transport.post(request("/unavailable", Duration.ofSeconds(5)));
    assertEquals(503, response.statusCode());
    assertEquals("try later", response.body());
    assertFalse(response.successful());
  }

  @Test
  void redirectsAreNotFollowed() throws Exception {
    WebhookResponse response = transport.post(request("/moved", Duration.ofSeconds(5)));
    assertEquals(302, response.statusCode());
    assertFalse(response.successful());
  }

  @Test
  void slowEndpointTimesOut() {
    assertThrows(HttpTimeoutException.class,
        () -> transport.post(request("/slow", Duration.ofMillis(300))));
  }

  private static String header(WebhookResponse response, String name) {
    return response.headers().entrySet().stream()
        .filter(e -> e.getKey().equalsIgnoreCase(name))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse(null);
  }

  private WebhookRequest request(String path, Duration timeout) {
    return new WebhookRequest(url(path), Map.of(), "{}".getBytes(StandardCharsets.UTF_8), timeout);
  }

  private String url(String path) {
    return "http://127.0.0.1:" + server.getAddress().getPort() + path;
  }

  private static void reply(HttpExchange exchange, int status, String body)
      throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }
}
