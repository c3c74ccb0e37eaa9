/**
 * Signed webhook POSTs to the CRM and classification of their results.
 */
package relay.webhook;
