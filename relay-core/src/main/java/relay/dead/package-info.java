/**
 * Operator tools for dead-lettered and auth-failed webhook deliveries.
 */
package relay.dead;
