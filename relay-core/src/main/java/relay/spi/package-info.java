/**
 * Service provider interfaces: persistence, collaborators and observability hooks
 * that the relay consumes but does not implement itself.
 */
package relay.spi;
