package eventrelay.webhook;

import java.io.IOException;

/**
 * Performs the HTTP POST of a webhook delivery.
 *
 * <p>Implementations must honour {@link WebhookRequest#timeout()} and signal an exceeded
 * timeout with {@link java.net.http.HttpTimeoutException}, which is logged as a distinct failure
 * category. Any response, including non-2xx, is returned rather than thrown.
 *
 * @see HttpClientWebhookTransport
 */
@FunctionalInterface
public interface WebhookTransport {

  /**
   * Sends the request.
   *
   * @param request the request
   * @return the response
   * @throws IOException          on timeout or transport failure
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  WebhookResponse post(WebhookRequest request) throws IOException, InterruptedException;
}
