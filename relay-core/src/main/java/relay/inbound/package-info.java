/**
 * Relay of platform events and outbound status changes to the CRM webhook.
 */
package relay.inbound;
