package eventrelay.webhook;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * An outbound webhook POST.
 *
 * @param url     target URL
 * @param headers request headers, in sending order
 * @param body    the exact body bytes that were signed
 * @param timeout request timeout
 */
public record WebhookRequest(String url, Map<String, String> headers, byte[] body, Duration timeout) {

  public WebhookRequest {
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(body, "body");
    Objects.requireNonNull(timeout, "timeout");
    headers = headers == null ? Map.of() : headers;
  }
}
