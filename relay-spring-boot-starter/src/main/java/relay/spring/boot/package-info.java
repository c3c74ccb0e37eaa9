/**
 * Spring Boot auto-configuration for the CRM relay.
 *
 * @see relay.spring.boot.RelayAutoConfiguration
 * @see relay.spring.boot.RelayProperties
 */
package relay.spring.boot;
