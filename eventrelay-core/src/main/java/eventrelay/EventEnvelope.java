package eventrelay;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of one domain occurrence, as handed to
 * {@link eventrelay.dispatch.EventDispatcher#publish}.
 *
 * <p>Each envelope is assigned a time-ordered UUID {@code eventId} (a monotonic ULID rendered in
 * UUID form) when none is supplied. The envelope does not validate its identifying fields;
 * {@code publish} rejects envelopes without an event type, aggregate type or aggregate id.
 *
 * <p>{@code payload} and {@code metadata} are defensively copied into unmodifiable maps. Nested
 * values are not copied and should be treated as read-only.
 *
 * @see eventrelay.dispatch.EventDispatcher
 * @see DomainEvents
 */
public final class EventEnvelope {

  /** Column widths of {@code outbox_event}; longer values are rejected at publish time. */
  public static final int MAX_EVENT_ID_LENGTH = 255;
  public static final int MAX_EVENT_TYPE_LENGTH = 128;
  public static final int MAX_AGGREGATE_TYPE_LENGTH = 100;
  public static final int MAX_AGGREGATE_ID_LENGTH = 255;

  private final String eventId;
  private final String eventType;
  private final String aggregateType;
  private final String aggregateId;
  private final Map<String, Object> payload;
  private final Map<String, Object> metadata;
  private final Long tenantId;
  private final Instant occurredAt;

  private EventEnvelope(Builder builder) {
    this.eventId = isBlank(builder.eventId) ? newEventId() : builder.eventId;
    this.eventType = builder.eventType;
    this.aggregateType = builder.aggregateType;
    this.aggregateId = builder.aggregateId;
    this.payload = copyOf(builder.payload, "payload");
    this.metadata = copyOf(builder.metadata, "metadata");
    this.tenantId = builder.tenantId;
    this.occurredAt = builder.occurredAt == null ? Instant.now() : builder.occurredAt;
  }

  /**
   * Creates a builder with a type-safe event type.
   *
   * @param eventType the event type
   * @return a new builder
   */
  public static Builder builder(EventType eventType) {
    Objects.requireNonNull(eventType, "eventType");
    return new Builder(eventType.value());
  }

  /**
   * Creates a builder with a string event type.
   *
   * @param eventType the dot-namespaced event type
   * @return a new builder
   */
  public static Builder builder(String eventType) {
    return new Builder(eventType);
  }

  /**
   * Returns a new time-ordered event identifier in UUID form.
   *
   * @return a UUID string
   */
  public static String newEventId() {
    return UlidCreator.getMonotonicUlid().toUuid().toString();
  }

  public String eventId() {
    return eventId;
  }

  public String eventType() {
    return eventType;
  }

  public String aggregateType() {
    return aggregateType;
  }

  public String aggregateId() {
    return aggregateId;
  }

  public Map<String, Object> payload() {
    return payload;
  }

  public Map<String, Object> metadata() {
    return metadata;
  }

  /**
   * Returns the tenant this event is scoped to, or {@code null} for tenant-less events.
   *
   * @return the tenant id, may be {@code null}
   */
  public Long tenantId() {
    return tenantId;
  }

  public Instant occurredAt() {
    return occurredAt;
  }

  @Override
  public String toString() {
    return "EventEnvelope{eventId=" + eventId
        + ", eventType=" + eventType
        + ", aggregateType=" + aggregateType
        + ", aggregateId=" + aggregateId
        + ", tenantId=" + tenantId + '}';
  }

  static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static Map<String, Object> copyOf(Map<String, ?> source, String field) {
    if (source == null || source.isEmpty()) {
      return Collections.emptyMap();
    }
    if (source.containsKey(null)) {
      throw new IllegalArgumentException(field + " cannot contain null keys");
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }

  /**
   * Builder for {@link EventEnvelope}.
   */
  public static final class Builder {
    private final String eventType;
    private String eventId;
    private String aggregateType;
    private String aggregateId;
    private Map<String, ?> payload;
    private Map<String, ?> metadata;
    private Long tenantId;
    private Instant occurredAt;

    private Builder(String eventType) {
      this.eventType = eventType;
    }

    /**
     * Sets a custom event identifier.
     *
     * <p>Optional. A blank value is treated as absent and replaced by a generated id.
     *
     * @param eventId the event identifier
     * @return this builder
     */
    public Builder eventId(String eventId) {
      this.eventId = eventId;
      return this;
    }

    /**
     * Sets the kind of entity the event describes, e.g. {@code "ticket"}.
     *
     * @param aggregateType the aggregate type
     * @return this builder
     */
    public Builder aggregateType(String aggregateType) {
      this.aggregateType = aggregateType;
      return this;
    }

    /**
     * Sets the identifier of the entity the event describes.
     *
     * @param aggregateId the aggregate identifier
     * @return this builder
     */
    public Builder aggregateId(String aggregateId) {
      this.aggregateId = aggregateId;
      return this;
    }

    /**
     * Sets the structured event payload.
     *
     * <p>Optional. Defaults to an empty map. Values must be serializable by the configured
     * {@link eventrelay.util.JsonCodec}.
     *
     * @param payload the payload
     * @return this builder
     */
    public Builder payload(Map<String, ?> payload) {
      this.payload = payload;
      return this;
    }

    /**
     * Sets free-form metadata (correlation ids, actor, source system).
     *
     * <p>Optional. Defaults to an empty map.
     *
     * @param metadata the metadata
     * @return this builder
     */
    public Builder metadata(Map<String, ?> metadata) {
      this.metadata = metadata;
      return this;
    }

    /**
     * Scopes the event to one tenant.
     *
     * <p>Optional. Defaults to {@code null}.
     *
     * @param tenantId the tenant identifier
     * @return this builder
     */
    public Builder tenantId(Long tenantId) {
      this.tenantId = tenantId;
      return this;
    }

    /**
     * Sets the time the domain occurrence happened.
     *
     * <p>Optional. Defaults to {@link Instant#now()} at build time.
     *
     * @param occurredAt the occurrence time
     * @return this builder
     */
    public Builder occurredAt(Instant occurredAt) {
      this.occurredAt = occurredAt;
      return this;
    }

    /**
     * Builds an immutable {@link EventEnvelope}.
     *
     * @return a new envelope
     * @throws IllegalArgumentException if {@code payload} or {@code metadata} contain a null key
     */
    public EventEnvelope build() {
      return new EventEnvelope(this);
    }
  }
}
