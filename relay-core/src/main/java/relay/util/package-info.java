/**
 * Internal helpers: thread factory, JSON codec, transaction templates and id generation.
 */
package relay.util;
