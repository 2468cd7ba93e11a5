package eventrelay.model;

import java.time.Instant;

/**
 * Aggregated delivery history of one event for one endpoint.
 *
 * @param endpointId    the endpoint
 * @param failures      number of failed attempts
 * @param succeeded     whether any attempt succeeded
 * @param lastAttemptAt time of the most recent attempt
 */
public record AttemptSummary(long endpointId, int failures, boolean succeeded, Instant lastAttemptAt) {}
