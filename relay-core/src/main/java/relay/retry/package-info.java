/**
 * Webhook retry engine and the backoff policies it schedules with.
 */
package relay.retry;
