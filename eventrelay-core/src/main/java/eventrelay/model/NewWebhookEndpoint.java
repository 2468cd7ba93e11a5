package eventrelay.model;

import eventrelay.EventType;
import eventrelay.ValidationException;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Registration request for a webhook endpoint.
 *
 * <p>Validated on {@link Builder#build()}: the URL must use the {@code http} or {@code https}
 * scheme and at least one event type is required.
 *
 * @see eventrelay.webhook.WebhookManager#createEndpoint
 */
public final class NewWebhookEndpoint {

  private final String name;
  private final String url;
  private final String secret;
  private final Set<String> eventTypes;
  private final boolean active;
  private final int timeoutSeconds;
  private final int maxRetries;
  private final Long tenantId;

  private NewWebhookEndpoint(Builder builder) {
    if (builder.url == null
        || !(builder.url.startsWith("http://") || builder.url.startsWith("https://"))) {
      throw new ValidationException("Webhook URL must start with http:// or https://");
    }
    if (builder.eventTypes.isEmpty()) {
      throw new ValidationException("At least one event type must be specified");
    }
    if (builder.timeoutSeconds <= 0) {
      throw new ValidationException("timeoutSeconds must be > 0");
    }
    if (builder.maxRetries < 0) {
      throw new ValidationException("maxRetries must be >= 0");
    }
    this.name = builder.name == null ? builder.url : builder.name;
    this.url = builder.url;
    this.secret = builder.secret == null || builder.secret.isEmpty() ? null : builder.secret;
    this.eventTypes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.eventTypes));
    this.active = builder.active;
    this.timeoutSeconds = builder.timeoutSeconds;
    this.maxRetries = builder.maxRetries;
    this.tenantId = builder.tenantId;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String name() {
    return name;
  }

  public String url() {
    return url;
  }

  public String secret() {
    return secret;
  }

  public Set<String> eventTypes() {
    return eventTypes;
  }

  public boolean active() {
    return active;
  }

  public int timeoutSeconds() {
    return timeoutSeconds;
  }

  public int maxRetries() {
    return maxRetries;
  }

  public Long tenantId() {
    return tenantId;
  }

  /** Builder for {@link NewWebhookEndpoint}. */
  public static final class Builder {
    private String name;
    private String url;
    private String secret;
    private final Set<String> eventTypes = new LinkedHashSet<>();
    private boolean active = true;
    private int timeoutSeconds = 30;
    private int maxRetries = 3;
    private Long tenantId;

    private Builder() {}

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    /**
     * Sets the target URL.
     *
     * <p><b>Required.</b> Must start with {@code http://} or {@code https://}.
     *
     * @param url the target URL
     * @return this builder
     */
    public Builder url(String url) {
      this.url = url;
      return this;
    }

    /**
     * Sets the HMAC-SHA256 signing secret.
     *
     * <p>Optional. Without a secret no {@code X-Hub-Signature-256} header is sent.
     *
     * @param secret the signing secret
     * @return this builder
     */
    public Builder secret(String secret) {
      this.secret = secret;
      return this;
    }

    /**
     * Adds subscribed event types. <b>At least one is required.</b>
     *
     * @param eventTypes dot-namespaced event types
     * @return this builder
     */
    public Builder eventTypes(Collection<String> eventTypes) {
      if (eventTypes != null) {
        for (String type : eventTypes) {
          if (type != null && !type.isBlank()) {
            this.eventTypes.add(type);
          }
        }
      }
      return this;
    }

    public Builder eventTypes(String... eventTypes) {
      return eventTypes(eventTypes == null ? null : Arrays.asList(eventTypes));
    }

    public Builder eventType(EventType eventType) {
      this.eventTypes.add(eventType.value());
      return this;
    }

    /**
     * Sets whether the endpoint starts active.
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param active the active flag
     * @return this builder
     */
    public Builder active(boolean active) {
      this.active = active;
      return this;
    }

    /**
     * Sets the per-request timeout.
     *
     * <p>Optional. Defaults to {@code 30}. Must be &gt; 0.
     *
     * @param timeoutSeconds timeout in seconds
     * @return this builder
     */
    public Builder timeoutSeconds(int timeoutSeconds) {
      this.timeoutSeconds = timeoutSeconds;
      return this;
    }

    /**
     * Sets how many times a failed delivery of one event is retried.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 0.
     *
     * @param maxRetries retries after the first failed attempt
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Scopes the endpoint to one tenant.
     *
     * <p>Optional. {@code null} (the default) registers a global endpoint that receives the
     * events of every tenant.
     *
     * @param tenantId the tenant identifier
     * @return this builder
     */
    public Builder tenantId(Long tenantId) {
      this.tenantId = tenantId;
      return this;
    }

    /**
     * @throws ValidationException if the URL scheme is not http(s), no event type was given,
     *     {@code timeoutSeconds <= 0} or {@code maxRetries < 0}
     */
    public NewWebhookEndpoint build() {
      return new NewWebhookEndpoint(this);
    }
  }
}
