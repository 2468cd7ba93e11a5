/**
 * In-process handler registration, keyed by event type with {@code "*"} as wildcard.
 */
package eventrelay.registry;
