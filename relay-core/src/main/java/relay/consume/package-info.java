/**
 * Queue consumer with topology installation, bounded workers, retry/dead-letter
 * handling and automatic reconnect.
 *
 * @see relay.consume.Subscriber
 */
package relay.consume;
