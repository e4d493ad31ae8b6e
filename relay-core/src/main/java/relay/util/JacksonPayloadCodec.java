package relay.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import relay.PayloadEncodingException;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link PayloadCodec} backed by a Jackson {@link ObjectMapper}.
 *
 * <p>The default mapper writes {@code java.time} values as ISO-8601 strings and ignores
 * unknown properties on read, so older consumers tolerate newer producers.
 */
public final class JacksonPayloadCodec implements PayloadCodec {
    static final JacksonPayloadCodec INSTANCE = new JacksonPayloadCodec(defaultMapper());

    private final ObjectMapper mapper;

    public JacksonPayloadCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    @Override
    public byte[] encode(Object payload) {
        if (payload instanceof byte[] bytes) {
            return bytes;
        }
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new PayloadEncodingException("Failed to serialize payload of type "
                    + (payload == null ? "null" : payload.getClass().getName()), e);
        }
    }

    @Override
    public <T> T decode(byte[] bytes, Class<T> type) {
        Objects.requireNonNull(type, "type");
        try {
            return mapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new PayloadEncodingException("Failed to deserialize payload as " + type.getName(), e);
        }
    }
}
