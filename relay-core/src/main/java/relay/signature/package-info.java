/**
 * HMAC signing of webhook bodies.
 */
package relay.signature;
