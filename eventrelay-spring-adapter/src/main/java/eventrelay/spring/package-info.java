/**
 * Spring transaction integration: {@link eventrelay.spring.SpringTxContext} lets
 * {@link eventrelay.dispatch.EventDispatcher#publish} join Spring-managed transactions.
 */
package eventrelay.spring;
