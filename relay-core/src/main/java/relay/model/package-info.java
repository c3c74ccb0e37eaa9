/**
 * Immutable domain records: messages, webhook deliveries, their statuses and
 * the status history.
 */
package relay.model;
