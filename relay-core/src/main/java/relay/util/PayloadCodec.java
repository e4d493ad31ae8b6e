package relay.util;

/**
 * Converts application payloads to and from the bytes carried by an
 * {@link relay.Envelope}.
 *
 * <p>The default implementation is {@link JacksonPayloadCodec}. Implementations must be
 * thread-safe; one codec instance is shared by every publisher and worker.
 *
 * @see #json()
 */
public interface PayloadCodec {

    /**
     * Returns the shared Jackson-backed JSON codec.
     *
     * @return the default codec
     */
    static PayloadCodec json() {
        return JacksonPayloadCodec.INSTANCE;
    }

    /**
     * Returns the MIME type written to envelopes produced with this codec.
     *
     * @return the content type
     */
    default String contentType() {
        return "application/json";
    }

    /**
     * Serializes a payload. {@code byte[]} payloads are passed through unchanged.
     *
     * @param payload the payload
     * @return the encoded bytes
     * @throws relay.PayloadEncodingException if the payload cannot be serialized
     */
    byte[] encode(Object payload);

    /**
     * Deserializes a payload.
     *
     * @param bytes the encoded bytes
     * @param type  the target type
     * @param <T>   the target type
     * @return the decoded value
     * @throws relay.PayloadEncodingException if the bytes cannot be decoded into {@code type}
     */
    <T> T decode(byte[] bytes, Class<T> type);
}
