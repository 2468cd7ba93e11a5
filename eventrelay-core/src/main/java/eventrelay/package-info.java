/**
 * Transactional outbox for domain events with signed webhook fan-out.
 *
 * <p>Business code builds an {@link eventrelay.EventEnvelope} (usually through
 * {@link eventrelay.DomainEvents}) and publishes it inside its own database transaction. The
 * {@link eventrelay.EventRelay} composite wires the dispatcher, poller, webhook worker and
 * retention jobs together.
 */
package eventrelay;
