package eventrelay.webhook;

import java.util.Map;

/**
 * The response to a webhook POST.
 *
 * @param statusCode HTTP status code
 * @param body       response body as text
 * @param headers    response headers (first value per name)
 */
public record WebhookResponse(int statusCode, String body, Map<String, String> headers) {

  public WebhookResponse {
    headers = headers == null ? Map.of() : headers;
  }

  public boolean successful() {
    return statusCode >= 200 && statusCode < 300;
  }
}
