package alpha.nomagicmvc.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Map;

/**
 * JSON serialization, using one shared {@code ObjectMapper}.<p>
 *
 * {@code ObjectMapper} is thread-safe once configured.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class Json
{
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<Map<String, Object>> MAP
            = new TypeReference<>() {};

    private Json() {
        // Empty
    }

    /**
     * Serializes a value.
     *
     * @param value to serialize (may be {@code null})
     * @return UTF-8 encoded JSON
     * @throws IllegalArgumentException if the value can not be serialized
     */
    static byte[] write(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Can not serialize " + value.getClass().getName() + " to JSON.", e);
        }
    }

    /**
     * Deserializes a JSON object.
     *
     * @param json UTF-8 encoded JSON object
     * @return a mutable map
     * @throws IOException if the input is not a JSON object
     */
    static Map<String, Object> readMap(byte[] json) throws IOException {
        Map<String, Object> m = MAPPER.readValue(json, MAP);
        if (m == null) {
            throw new IOException("JSON null, expected an object.");
        }
        return m;
    }
}
