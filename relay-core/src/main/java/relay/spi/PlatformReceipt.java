package relay.spi;

/**
 * Successful answer of the platform send API.
 *
 * @param platformMessageId id the platform assigned to the sent message
 */
public record PlatformReceipt(String platformMessageId) {
}
