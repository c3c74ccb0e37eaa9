/**
 * Outbound sends from the CRM to the messaging platform.
 *
 * <p>{@link relay.outbound.OutboundDispatcher} answers send requests at once and drives
 * the platform call, its local retries and later platform receipts in the background.
 */
package relay.outbound;
