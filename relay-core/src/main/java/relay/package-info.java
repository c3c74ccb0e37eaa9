/**
 * Reliable message relay between a messaging platform and a CRM.
 *
 * <p>{@link relay.Relay} is the composite entry point. Exceptions thrown to callers
 * extend {@link relay.RelayException}.
 */
package relay;
