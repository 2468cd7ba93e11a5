package eventrelay.webhook;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link WebhookTransport} on {@link java.net.http.HttpClient}.
 *
 * <p>Redirects are not followed: a 3xx response is a failed delivery. The per-request timeout
 * comes from the endpoint configuration.
 */
public final class HttpClientWebhookTransport implements WebhookTransport {

  private final HttpClient client;

  public HttpClientWebhookTransport() {
    this(HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .followRedirects(HttpClient.Redirect.NEVER)
        .build());
  }

  public HttpClientWebhookTransport(HttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public WebhookResponse post(WebhookRequest request) throws IOException, InterruptedException {
    HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(request.url()))
        .timeout(request.timeout())
        .POST(HttpRequest.BodyPublishers.ofByteArray(request.body()));
    request.headers().forEach(builder::header);

    HttpResponse<String> response = client.send(builder.build(),
        HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

    Map<String, String> headers = new LinkedHashMap<>();
    for (Map.Entry<String, List<String>> entry : response.headers().map().entrySet()) {
      if (!entry.getValue().isEmpty()) {
        headers.put(entry.getKey(), entry.getValue().get(0));
      }
    }
    return new WebhookResponse(response.statusCode(), response.body(), headers);
  }
}
