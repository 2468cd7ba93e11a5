package eventrelay.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of an outbox record.
 *
 * <p>Legal transitions:
 * <pre>
 * PENDING    -&gt; PROCESSING
 * PROCESSING -&gt; PUBLISHED | RETRYING | FAILED
 * RETRYING   -&gt; PROCESSING
 * FAILED     -&gt; PENDING        (operator replay)
 * PUBLISHED  (terminal)
 * </pre>
 *
 * <p>Stores derive the {@code WHERE status IN (...)} guard of every update from
 * {@link #sourcesOf(EventStatus)}, so an illegal transition updates zero rows.
 */
public enum EventStatus {
  PENDING(0),
  PROCESSING(1),
  PUBLISHED(2),
  RETRYING(3),
  FAILED(4);

  private final int code;

  EventStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public Set<EventStatus> allowedTargets() {
    return switch (this) {
      case PENDING -> Collections.unmodifiableSet(EnumSet.of(PROCESSING));
      case PROCESSING -> Collections.unmodifiableSet(EnumSet.of(PUBLISHED, RETRYING, FAILED));
      case RETRYING -> Collections.unmodifiableSet(EnumSet.of(PROCESSING));
      case FAILED -> Collections.unmodifiableSet(EnumSet.of(PENDING));
      case PUBLISHED -> Collections.emptySet();
    };
  }

  public boolean canTransitionTo(EventStatus target) {
    return allowedTargets().contains(target);
  }

  public boolean isTerminal() {
    return allowedTargets().isEmpty();
  }

  /**
   * Returns every status from which {@code target} may be entered.
   *
   * @param target the destination status
   * @return the legal source statuses (possibly empty)
   */
  public static Set<EventStatus> sourcesOf(EventStatus target) {
    EnumSet<EventStatus> sources = EnumSet.noneOf(EventStatus.class);
    for (EventStatus status : values()) {
      if (status.canTransitionTo(target)) {
        sources.add(status);
      }
    }
    return Collections.unmodifiableSet(sources);
  }

  /**
   * Resolves a persisted status code.
   *
   * @throws IllegalArgumentException if the code is unknown
   */
  public static EventStatus fromCode(int code) {
    for (EventStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown event status code: " + code);
  }
}
