/**
 * Queries over messages, webhook deliveries and their status history.
 */
package relay.status;
