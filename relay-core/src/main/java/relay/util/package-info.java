/**
 * Shared helpers: payload codecs, reconnect backoff and thread naming.
 */
package relay.util;
