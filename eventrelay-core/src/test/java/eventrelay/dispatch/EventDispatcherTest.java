package eventrelay.dispatch;

import eventrelay.DomainEventType;
import eventrelay.DomainEvents;
import eventrelay.EventEnvelope;
import eventrelay.ValidationException;
import eventrelay.model.EventStatus;
import eventrelay.model.OutboxRecord;
import eventrelay.stub.Connections;
import eventrelay.stub.InMemoryOutboxStore;
import eventrelay.stub.StubTxContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventDispatcherTest {

  private InMemoryOutboxStore store;
  private StubTxContext tx;
  private EventDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    store = new InMemoryOutboxStore();
    tx = new StubTxContext();
    dispatcher = EventDispatcher.builder()
        .txContext(tx)
        .connectionProvider(Connections.dummyProvider())
        .outboxStore(store)
        .build();
  }

  // ── Builder validation ──────────────────────────────────────────

  @Test
  void builderRejectsMissingCollaborators() {
    assertThrows(NullPointerException.class, () -> EventDispatcher.builder()
        .connectionProvider(Connections.dummyProvider())
        .outboxStore(store)
        .build());
    assertThrows(NullPointerException.class, () -> EventDispatcher.builder()
        .txContext(tx)
        .outboxStore(store)
        .build());
    assertThrows(NullPointerException.class, () -> EventDispatcher.builder()
        .txContext(tx)
        .connectionProvider(Connections.dummyProvider())
        .build());
  }

  @Test
  void builderRejectsNegativeMaxRetries() {
    assertThrows(IllegalArgumentException.class, () -> EventDispatcher.builder()
        .txContext(tx)
        .connectionProvider(Connections.dummyProvider())
        .outboxStore(store)
        .maxRetries(-1)
        .build());
  }

  // ── Publishing ─────────────────────────────────────────────────

  @Test
  void publishInsertsPendingRecord() {
    tx.active(true);
    OutboxRecord record = dispatcher.publish(
        DomainEvents.ticketCreated(42L, 1L, "TCK-42", "Printer jammed", Map.of("priority", "high")));

    assertEquals(EventStatus.PENDING, record.status());
    assertEquals(0, record.retryCount());
    assertEquals(3, record.maxRetries());
    assertNull(record.processedAt());
    assertEquals("ticket.created", record.eventType());
    assertEquals("42", record.aggregateId());
    assertEquals(1L, record.tenantId());
    assertEquals("high", record.payload().get("priority"));
    assertEquals(List.of(record), store.all());
  }

  @Test
  void publishWithoutTransactionThrows() {
    assertThrows(IllegalStateException.class,
        () -> dispatcher.publish(DomainEvents.assetCreated(1L, null, "SN-1", Map.of())));
    assertTrue(store.all().isEmpty());
  }

  @Test
  void publishRejectsMissingFields() {
    tx.active(true);
    assertThrows(ValidationException.class, () -> dispatcher.publish(null));
    assertThrows(ValidationException.class, () -> dispatcher.publish(
        EventEnvelope.builder(" ").aggregateType("ticket").aggregateId("1").build()));
    assertThrows(ValidationException.class, () -> dispatcher.publish(
        EventEnvelope.builder("ticket.created").aggregateId("1").build()));
    assertThrows(ValidationException.class, () -> dispatcher.publish(
        EventEnvelope.builder("ticket.created").aggregateType("ticket").aggregateId("").build()));
    assertTrue(store.all().isEmpty());
  }

  @Test
  void publishRejectsIdentifiersLongerThanTheirColumns() {
    tx.active(true);
    ValidationException tooLong = assertThrows(ValidationException.class, () -> dispatcher.publish(
        EventEnvelope.builder("ticket.created").aggregateType("t".repeat(101)).aggregateId("1")
            .build()));
    assertTrue(tooLong.getMessage().startsWith("aggregateType exceeds 100"), tooLong.getMessage());
    assertThrows(ValidationException.class, () -> dispatcher.publish(
        EventEnvelope.builder("ticket.created").eventId("e".repeat(256)).aggregateType("ticket")
            .aggregateId("1").build()));
    assertThrows(ValidationException.class, () -> dispatcher.publish(
        EventEnvelope.builder("ticket.created").aggregateType("ticket").aggregateId("9".repeat(256))
            .build()));
    assertTrue(store.all().isEmpty());

    OutboxRecord atLimit = dispatcher.publish(
        EventEnvelope.builder("ticket.created").eventId("e".repeat(255))
            .aggregateType("t".repeat(100)).aggregateId("9".repeat(255)).build());
    assertEquals(255, atLimit.eventId().length());
  }

  @Test
  void publishBatchValidatesEverythingBeforeWriting() {
    tx.active(true);
    List<EventEnvelope> batch = List.of(
        DomainEvents.assetCreated(1L, 1L, "SN-1", Map.of()),
        EventEnvelope.builder("asset.created").aggregateType("asset").build());

    assertThrows(ValidationException.class, () -> dispatcher.publishBatch(batch));
    assertTrue(store.all().isEmpty());

    List<OutboxRecord> written = dispatcher.publishBatch(List.of(
        DomainEvents.assetCreated(1L, 1L, "SN-1", Map.of()),
        DomainEvents.assetCreated(2L, 1L, "SN-2", Map.of())));
    assertEquals(2, written.size());
    assertEquals(2, store.all().size());
  }

  @Test
  void maxRetriesIsStampedAtPublishTime() {
    EventDispatcher generous = EventDispatcher.builder()
        .txContext(tx.active(true))
        .connectionProvider(Connections.dummyProvider())
        .outboxStore(store)
        .maxRetries(7)
        .build();
    assertEquals(7, generous.publish(DomainEvents.assetCreated(1L, null, "SN", Map.of()))
        .maxRetries());
  }

  // ── Status transitions ─────────────────────────────────────────

  @Test
  void retrySequenceEndsInFailed() {
    String id = published();

    assertTrue(dispatcher.markProcessing(id));
    assertEquals(EventStatus.RETRYING, dispatcher.markFailed(id, "timeout"));
    OutboxRecord first = dispatcher.find(id).orElseThrow();
    assertEquals(1, first.retryCount());
    assertEquals("timeout", first.lastError());

    assertTrue(dispatcher.markProcessing(id));
    assertEquals(EventStatus.RETRYING, dispatcher.markFailed(id, "timeout"));
    OutboxRecord second = dispatcher.find(id).orElseThrow();
    assertEquals(2, second.retryCount());
    assertTrue(second.nextRetryAt().isAfter(first.nextRetryAt()));

    assertTrue(dispatcher.markProcessing(id));
    assertEquals(EventStatus.FAILED, dispatcher.markFailed(id, "timeout"));
    OutboxRecord failed = dispatcher.find(id).orElseThrow();
    assertEquals(3, failed.retryCount());
    assertNull(failed.nextRetryAt());
  }

  @Test
  void retryDelayGrowsLinearly() {
    String id = published();
    Instant before = Instant.now();
    dispatcher.markProcessing(id);
    dispatcher.markFailed(id, "boom", 2);

    Instant next = dispatcher.find(id).orElseThrow().nextRetryAt();
    Duration delay = Duration.between(before, next);
    assertTrue(delay.compareTo(Duration.ofMinutes(2)) >= 0, "delay " + delay);
    assertTrue(delay.compareTo(Duration.ofMinutes(3)) < 0, "delay " + delay);
  }

  @Test
  void markFailedIgnoresRecordsNotProcessing() {
    String id = published();
    assertNull(dispatcher.markFailed(id, "boom"));
    assertNull(dispatcher.markFailed("missing", "boom"));
    assertEquals(EventStatus.PENDING, dispatcher.find(id).orElseThrow().status());
  }

  @Test
  void markPublishedRequiresProcessing() {
    String id = published();
    assertFalse(dispatcher.markPublished(id));
    assertTrue(dispatcher.markProcessing(id));
    assertFalse(dispatcher.markProcessing(id));
    assertTrue(dispatcher.markPublished(id));
    assertNotNull(dispatcher.find(id).orElseThrow().processedAt());
  }

  @Test
  void longErrorsAreTruncated() {
    String id = published();
    dispatcher.markProcessing(id);
    dispatcher.markFailed(id, "e".repeat(OutboxRecord.MAX_ERROR_LENGTH + 100));
    assertEquals(OutboxRecord.MAX_ERROR_LENGTH, dispatcher.find(id).orElseThrow().lastError().length());
  }

  @Test
  void listPendingFiltersAndLimits() {
    tx.active(true);
    dispatcher.publish(DomainEvents.ticketCreated(1L, 1L, "T-1", "a", Map.of()));
    dispatcher.publish(DomainEvents.assetCreated(2L, 1L, "SN-2", Map.of()));
    dispatcher.publish(DomainEvents.ticketCreated(3L, 1L, "T-3", "b", Map.of()));
    tx.active(false);

    assertEquals(2, dispatcher.listPending(2).size());
    assertEquals(2, dispatcher.listPending(10, Set.of("ticket.created")).size());
    assertThrows(IllegalArgumentException.class, () -> dispatcher.listPending(0));
  }

  // ── Processing ─────────────────────────────────────────────────

  @Test
  void processRunsHandlersInRegistrationOrderThenWildcard() {
    List<String> calls = new ArrayList<>();
    dispatcher.registerHandler("*", r -> calls.add("audit"));
    dispatcher.registerHandler(DomainEventType.TICKET_CREATED, r -> calls.add("first"));
    dispatcher.registerHandler("ticket.created", r -> calls.add("second"));
    dispatcher.registerHandler("asset.created", r -> calls.add("asset"));

    String id = published();
    assertTrue(dispatcher.process(dispatcher.find(id).orElseThrow()));

    assertEquals(List.of("first", "second", "audit"), calls);
    assertEquals(EventStatus.PUBLISHED, dispatcher.find(id).orElseThrow().status());
  }

  @Test
  void processWithoutHandlersPublishes() {
    String id = published();
    assertTrue(dispatcher.process(dispatcher.find(id).orElseThrow()));
    assertEquals(EventStatus.PUBLISHED, dispatcher.find(id).orElseThrow().status());
  }

  @Test
  void firstHandlerFailureStopsTheRest() {
    List<String> calls = new ArrayList<>();
    dispatcher.registerHandler("ticket.created", r -> {
      throw new IllegalStateException("search index down");
    });
    dispatcher.registerHandler("ticket.created", r -> calls.add("never"));

    String id = published();
    assertFalse(dispatcher.process(dispatcher.find(id).orElseThrow()));

    assertTrue(calls.isEmpty());
    OutboxRecord record = dispatcher.find(id).orElseThrow();
    assertEquals(EventStatus.RETRYING, record.status());
    assertEquals("search index down", record.lastError());
  }

  @Test
  void processSkipsRecordsAlreadyClaimed() {
    String id = published();
    OutboxRecord snapshot = dispatcher.find(id).orElseThrow();
    assertTrue(dispatcher.markProcessing(id));
    assertFalse(dispatcher.process(snapshot));
    assertEquals(EventStatus.PROCESSING, dispatcher.find(id).orElseThrow().status());
  }

  @Test
  void claimPendingMovesRecordsToProcessing() {
    String id = published();
    List<OutboxRecord> claimed = dispatcher.claimPending(10, null);
    assertEquals(1, claimed.size());
    assertEquals(EventStatus.PROCESSING, claimed.get(0).status());
    assertTrue(dispatcher.processClaimed(claimed.get(0)));
    assertEquals(EventStatus.PUBLISHED, dispatcher.find(id).orElseThrow().status());
  }

  @Test
  void releaseStaleReturnsOrphansWithoutConsumingARetry() {
    String id = published();
    dispatcher.markProcessing(id);

    assertEquals(1, dispatcher.releaseStale(Instant.now().plusSeconds(1)));
    OutboxRecord released = dispatcher.find(id).orElseThrow();
    assertEquals(EventStatus.RETRYING, released.status());
    assertEquals(0, released.retryCount());
    assertEquals(1, dispatcher.listPending(10).size());
  }

  @Test
  void purgeRemovesOldPublishedRecords() throws Exception {
    String id = published();
    dispatcher.markProcessing(id);
    dispatcher.markPublished(id);
    String pending = published();
    Thread.sleep(5);

    assertEquals(0, dispatcher.purge(1));
    assertEquals(1, dispatcher.purge(0));
    assertTrue(dispatcher.find(id).isEmpty());
    assertTrue(dispatcher.find(pending).isPresent());
    assertThrows(IllegalArgumentException.class, () -> dispatcher.purge(-1));
  }

  @Test
  void connectionFailuresFallBackQuietly() {
    EventDispatcher broken = EventDispatcher.builder()
        .txContext(tx)
        .connectionProvider(Connections.failingProvider())
        .outboxStore(store)
        .build();

    assertTrue(broken.listPending(10).isEmpty());
    assertTrue(broken.find("e-1").isEmpty());
    assertFalse(broken.markProcessing("e-1"));
    assertNull(broken.markFailed("e-1", "x"));
  }

  private String published() {
    tx.active(true);
    try {
      return dispatcher.publish(DomainEvents.ticketCreated(1L, 1L, "T-1", "t", Map.of())).eventId();
    } finally {
      tx.active(false);
    }
  }
}
