/**
 * At-most-once reservation of outbound sends per account and idempotency key.
 */
package relay.idempotency;
