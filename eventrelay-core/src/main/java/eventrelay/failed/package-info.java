/**
 * Inspection and replay of records that exhausted their retry budget.
 */
package eventrelay.failed;
