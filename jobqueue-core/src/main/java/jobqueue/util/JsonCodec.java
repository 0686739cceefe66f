package jobqueue.util;

import java.util.Map;

/**
 * Codec for JSON objects carried in queue messages and job records.
 *
 * <p>Values are mapped to plain Java types: {@link String}, {@link Long} or
 * {@link Double} for numbers, {@link Boolean}, {@code null}, {@link java.util.List}
 * for arrays and {@code Map<String, Object>} for nested objects.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) is a small,
 * zero-dependency encoder/decoder. Users who already have Jackson, Gson, or another
 * JSON library on the classpath can implement this interface to delegate to it.
 *
 * @see #getDefault()
 * @see DefaultJsonCodec
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
     * Encodes a map as a JSON object string. Entries are written in iteration order.
     *
     * @param object the object to encode
     * @return JSON string ({@code "{}"} for a null or empty map)
     * @throws IllegalArgumentException if a key is null or a value has an unsupported type
     */
    String toJson(Map<String, ?> object);

    /**
     * Parses a JSON object string. Returns an empty map for {@code null},
     * empty, or {@code "null"} input.
     *
     * @param json the JSON string to parse
     * @return parsed map (never {@code null}), preserving key order
     * @throws IllegalArgumentException if the input is not a valid JSON object
     */
    Map<String, Object> parseObject(String json);
}
