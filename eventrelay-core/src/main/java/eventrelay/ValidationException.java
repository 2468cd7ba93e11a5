package eventrelay;

/**
 * Thrown when an event envelope or a webhook endpoint definition is structurally invalid.
 *
 * <p>Raised synchronously to the caller. When thrown from
 * {@link eventrelay.dispatch.EventDispatcher#publish} the caller decides whether to abort the
 * surrounding business transaction.
 */
public class ValidationException extends IllegalArgumentException {

  public ValidationException(String message) {
    super(message);
  }
}
