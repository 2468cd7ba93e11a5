package eventrelay.stub;

import eventrelay.model.EventStatus;
import eventrelay.model.OutboxRecord;
import eventrelay.spi.OutboxStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Map-backed {@link OutboxStore} with the same transition guards as the JDBC stores.
 */
public class InMemoryOutboxStore implements OutboxStore {
  private static final Comparator<OutboxRecord> OLDEST_FIRST =
      Comparator.comparing(OutboxRecord::createdAt).thenComparing(OutboxRecord::eventId);

  private final Map<String, OutboxRecord> records = new LinkedHashMap<>();

  public synchronized void put(OutboxRecord record) {
    records.put(record.eventId(), record);
  }

  public synchronized List<OutboxRecord> all() {
    return List.copyOf(records.values());
  }

  @Override
  public synchronized void insert(Connection conn, OutboxRecord record) {
    if (records.containsKey(record.eventId())) {
      throw new IllegalStateException("Duplicate event id " + record.eventId());
    }
    records.put(record.eventId(), record);
  }

  @Override
  public synchronized Optional<OutboxRecord> findById(Connection conn, String eventId) {
    return Optional.ofNullable(records.get(eventId));
  }

  @Override
  public synchronized List<OutboxRecord> listPending(Connection conn, Instant now, int limit,
      Collection<String> eventTypes) {
    return select(r -> eligible(r, now)
        && (eventTypes == null || eventTypes.isEmpty() || eventTypes.contains(r.eventType())), limit);
  }

  private static boolean eligible(OutboxRecord r, Instant now) {
    if (r.status() == EventStatus.PENDING) {
      return true;
    }
    return r.status() == EventStatus.RETRYING
        && (r.nextRetryAt() == null || !r.nextRetryAt().isAfter(now));
  }

  @Override
  public synchronized int markProcessing(Connection conn, String eventId, Instant now) {
    return transition(eventId, EventStatus.PROCESSING, r -> copy(r, EventStatus.PROCESSING,
        r.retryCount(), r.processedAt(), r.nextRetryAt(), r.lastError(), now, r.deliveredAt()));
  }

  @Override
  public synchronized int markPublished(Connection conn, String eventId, Instant now) {
    return transition(eventId, EventStatus.PUBLISHED, r -> copy(r, EventStatus.PUBLISHED,
        r.retryCount(), now, null, r.lastError(), null, r.deliveredAt()));
  }

  @Override
  public synchronized int markRetrying(Connection conn, String eventId, Instant nextRetryAt,
      String error) {
    return transition(eventId, EventStatus.RETRYING, r -> copy(r, EventStatus.RETRYING,
        r.retryCount() + 1, r.processedAt(), nextRetryAt, OutboxRecord.truncateError(error), null,
        r.deliveredAt()));
  }

  @Override
  public synchronized int markFailed(Connection conn, String eventId, String error) {
    return transition(eventId, EventStatus.FAILED, r -> copy(r, EventStatus.FAILED,
        r.retryCount() + 1, r.processedAt(), null, OutboxRecord.truncateError(error), null,
        r.deliveredAt()));
  }

  @Override
  public synchronized int releaseStale(Connection conn, Instant lockedBefore, Instant now) {
    int released = 0;
    for (OutboxRecord r : List.copyOf(records.values())) {
      if (r.status() == EventStatus.PROCESSING && r.lockedAt() != null
          && r.lockedAt().isBefore(lockedBefore)) {
        records.put(r.eventId(), copy(r, EventStatus.RETRYING, r.retryCount(), r.processedAt(),
            now, r.lastError(), null, r.deliveredAt()));
        released++;
      }
    }
    return released;
  }

  @Override
  public synchronized int releaseClaim(Connection conn, String eventId, Instant now) {
    OutboxRecord r = records.get(eventId);
    if (r == null || r.status() != EventStatus.PROCESSING) {
      return 0;
    }
    records.put(eventId, copy(r, EventStatus.RETRYING, r.retryCount(), r.processedAt(), now,
        r.lastError(), null, r.deliveredAt()));
    return 1;
  }

  @Override
  public synchronized List<OutboxRecord> listUndelivered(Connection conn, Instant now, int limit) {
    return select(r -> r.status() == EventStatus.PUBLISHED && r.deliveredAt() == null
        && (r.nextDeliveryAt() == null || !r.nextDeliveryAt().isAfter(now)), limit);
  }

  @Override
  public synchronized int scheduleDelivery(Connection conn, String eventId, Instant nextDeliveryAt) {
    OutboxRecord r = records.get(eventId);
    if (r == null || r.status() != EventStatus.PUBLISHED || r.deliveredAt() != null) {
      return 0;
    }
    records.put(eventId, new OutboxRecord(r.eventId(), r.eventType(), r.aggregateType(),
        r.aggregateId(), r.payload(), r.metadata(), r.tenantId(), r.occurredAt(), r.status(),
        r.retryCount(), r.maxRetries(), r.createdAt(), r.processedAt(), r.nextRetryAt(),
        r.lastError(), r.lockedAt(), r.deliveredAt(), nextDeliveryAt));
    return 1;
  }

  @Override
  public synchronized int markDelivered(Connection conn, String eventId, Instant now) {
    OutboxRecord r = records.get(eventId);
    if (r == null || r.status() != EventStatus.PUBLISHED || r.deliveredAt() != null) {
      return 0;
    }
    records.put(eventId, copy(r, r.status(), r.retryCount(), r.processedAt(), r.nextRetryAt(),
        r.lastError(), r.lockedAt(), now));
    return 1;
  }

  @Override
  public synchronized List<OutboxRecord> queryFailed(Connection conn, String eventType, int limit) {
    return select(r -> r.status() == EventStatus.FAILED
        && (eventType == null || eventType.equals(r.eventType())), limit);
  }

  @Override
  public synchronized int countFailed(Connection conn, String eventType) {
    return select(r -> r.status() == EventStatus.FAILED
        && (eventType == null || eventType.equals(r.eventType())), Integer.MAX_VALUE).size();
  }

  @Override
  public synchronized int replayFailed(Connection conn, String eventId) {
    return transition(eventId, EventStatus.PENDING, r -> copy(r, EventStatus.PENDING, 0,
        r.processedAt(), null, null, null, r.deliveredAt()));
  }

  @Override
  public synchronized int purgePublished(Connection conn, Instant before, int limit) {
    List<OutboxRecord> expired = records.values().stream()
        .filter(r -> r.status() == EventStatus.PUBLISHED && r.processedAt() != null
            && r.processedAt().isBefore(before))
        .sorted(Comparator.comparing(OutboxRecord::processedAt))
        .limit(limit)
        .toList();
    expired.forEach(r -> records.remove(r.eventId()));
    return expired.size();
  }

  private List<OutboxRecord> select(Predicate<OutboxRecord> filter, int limit) {
    return records.values().stream().filter(filter).sorted(OLDEST_FIRST).limit(limit).toList();
  }

  private int transition(String eventId, EventStatus target,
      UnaryOperator<OutboxRecord> change) {
    OutboxRecord r = records.get(eventId);
    if (r == null || !r.status().canTransitionTo(target)) {
      return 0;
    }
    records.put(eventId, change.apply(r));
    return 1;
  }

  private static OutboxRecord copy(OutboxRecord r, EventStatus status, int retryCount,
      Instant processedAt, Instant nextRetryAt, String lastError, Instant lockedAt,
      Instant deliveredAt) {
    return new OutboxRecord(r.eventId(), r.eventType(), r.aggregateType(), r.aggregateId(),
        r.payload(), r.metadata(), r.tenantId(), r.occurredAt(), status, retryCount,
        r.maxRetries(), r.createdAt(), processedAt, nextRetryAt, lastError, lockedAt, deliveredAt,
        deliveredAt == null ? r.nextDeliveryAt() : null);
  }
}
