/**
 * Routing-key to callback lookup used by the subscriber.
 *
 * @see relay.registry.CallbackRegistry
 * @see relay.registry.DefaultCallbackRegistry
 */
package relay.registry;
