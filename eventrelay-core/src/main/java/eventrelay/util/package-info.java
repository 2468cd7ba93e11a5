/**
 * Small shared utilities: JSON codec and daemon thread naming.
 */
package eventrelay.util;
