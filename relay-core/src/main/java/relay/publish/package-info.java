/**
 * Confirmed publishing of JSON events.
 */
package relay.publish;
