package relay.util;

import java.util.Map;

/**
 * Codec for the JSON bodies the relay sends to CRM webhooks.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) is a zero-dependency encoder
 * for objects made of strings, numbers, booleans, {@code null} and nested
 * objects. Applications that already carry Jackson or Gson can implement this interface
 * to delegate to their preferred library.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a map as a JSON object. Entries keep the map's iteration order.
     *
     * @param object the object to encode; values may be {@link String}, {@link Number},
     *               {@link Boolean}, {@code null} or a nested {@link Map}
     * @return JSON text
     * @throws IllegalArgumentException on null keys or unsupported value types
     */
    String toJson(Map<String, ?> object);
}
