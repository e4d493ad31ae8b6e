package relay;

import com.github.f4b6a3.ulid.UlidCreator;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable unit of transfer between a publisher and a subscriber.
 *
 * <p>Carries the routing key, the serialized payload, its content type, the delivery
 * durability flag and a header table. The {@value #ATTEMPT_HEADER} header counts retry
 * passes; it is absent (read as {@code 0}) on first publish and only ever changed by the
 * retry path through {@link #withAttempt(int)}.
 *
 * <p>Each envelope gets a ULID {@code messageId} by default, which callbacks can use to
 * deduplicate redeliveries.
 *
 * @see relay.publish.Publisher
 * @see Delivery
 */
public final class Envelope {
    public static final String ATTEMPT_HEADER = "attempt";
    public static final String JSON_CONTENT_TYPE = "application/json";
    public static final int MAX_PAYLOAD_BYTES = 16 * 1024 * 1024; // 16MB

    private final String routingKey;
    private final String messageId;
    private final Instant timestamp;
    private final String contentType;
    private final boolean persistent;
    private final Map<String, Object> headers;
    private final byte[] payload;

    private Envelope(Builder builder) {
        this.routingKey = Objects.requireNonNull(builder.routingKey, "routingKey");
        this.messageId = builder.messageId == null ? newMessageId() : builder.messageId;
        this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
        this.contentType = builder.contentType == null ? JSON_CONTENT_TYPE : builder.contentType;
        this.persistent = builder.persistent;

        Map<String, Object> headerCopy = builder.headers == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        if (headerCopy.containsKey(null)) {
            throw new IllegalArgumentException("headers cannot contain null keys");
        }
        if (headerCopy.containsValue(null)) {
            throw new IllegalArgumentException("headers cannot contain null values");
        }
        this.headers = headerCopy;

        if (builder.payload == null) {
            throw new IllegalArgumentException("payload must be set");
        }
        if (builder.payload.length > MAX_PAYLOAD_BYTES) {
            throw new IllegalArgumentException("Payload exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
        }
        this.payload = Arrays.copyOf(builder.payload, builder.payload.length);
    }

    /**
     * Creates a builder for a type-safe routing key.
     *
     * @param routingKey the routing key
     * @return a new builder
     */
    public static Builder builder(RoutingKey routingKey) {
        Objects.requireNonNull(routingKey, "routingKey");
        return new Builder(routingKey.name());
    }

    /**
     * Creates a builder for a string routing key.
     *
     * @param routingKey the routing key (may be empty for fan-out style exchanges)
     * @return a new builder
     */
    public static Builder builder(String routingKey) {
        return new Builder(routingKey);
    }

    /**
     * Creates a persistent JSON envelope.
     *
     * @param routingKey the routing key
     * @param json       the JSON payload
     * @return a new envelope
     */
    public static Envelope ofJson(String routingKey, String json) {
        return builder(routingKey).payload(json.getBytes(StandardCharsets.UTF_8)).build();
    }

    public String routingKey() {
        return routingKey;
    }

    public String messageId() {
        return messageId;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public String contentType() {
        return contentType;
    }

    public boolean persistent() {
        return persistent;
    }

    public Map<String, Object> headers() {
        return headers;
    }

    public byte[] payload() {
        return Arrays.copyOf(payload, payload.length);
    }

    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    /**
     * Returns the retry pass this envelope is on, read from the {@value #ATTEMPT_HEADER}
     * header. Missing, negative or unreadable values count as {@code 0}.
     *
     * @return the attempt number, never negative
     */
    public int attempt() {
        return readAttempt(headers.get(ATTEMPT_HEADER));
    }

    /**
     * Returns a copy of this envelope with the {@value #ATTEMPT_HEADER} header set.
     * Every other field, including the message id, is kept.
     *
     * @param attempt the new attempt number
     * @return a new envelope
     */
    public Envelope withAttempt(int attempt) {
        Map<String, Object> copy = new LinkedHashMap<>(headers);
        copy.put(ATTEMPT_HEADER, Math.max(0, attempt));
        return toBuilder().headers(copy).build();
    }

    /**
     * Returns a builder pre-populated with this envelope's fields.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        return new Builder(routingKey)
                .messageId(messageId)
                .timestamp(timestamp)
                .contentType(contentType)
                .persistent(persistent)
                .headers(headers)
                .payload(payload);
    }

    static int readAttempt(Object value) {
        if (value == null) {
            return 0;
        }
        long parsed;
        if (value instanceof Number number) {
            parsed = number.longValue();
        } else {
            try {
                parsed = Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        if (parsed < 0) {
            return 0;
        }
        return parsed > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) parsed;
    }

    private static String newMessageId() {
        return UlidCreator.getMonotonicUlid().toString();
    }

    @Override
    public String toString() {
        return "Envelope{messageId=" + messageId
                + ", routingKey=" + routingKey
                + ", contentType=" + contentType
                + ", attempt=" + attempt()
                + ", size=" + payload.length + '}';
    }

    /**
     * Builder for {@link Envelope}.
     */
    public static final class Builder {
        private final String routingKey;
        private String messageId;
        private Instant timestamp;
        private String contentType;
        private boolean persistent = true;
        private Map<String, Object> headers;
        private byte[] payload;

        private Builder(String routingKey) {
            this.routingKey = routingKey;
        }

        /**
         * Sets a custom message identifier.
         *
         * <p>Optional. Defaults to a monotonic ULID.
         *
         * @param messageId the message identifier
         * @return this builder
         */
        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        /**
         * Sets the message timestamp.
         *
         * <p>Optional. Defaults to {@link Instant#now()}.
         *
         * @param timestamp the message timestamp
         * @return this builder
         */
        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /**
         * Sets the payload content type.
         *
         * <p>Optional. Defaults to {@value Envelope#JSON_CONTENT_TYPE}.
         *
         * @param contentType the MIME type of the payload
         * @return this builder
         */
        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        /**
         * Sets whether the broker must write the message to disk.
         *
         * <p>Optional. Defaults to {@code true}.
         *
         * @param persistent the delivery durability flag
         * @return this builder
         */
        public Builder persistent(boolean persistent) {
            this.persistent = persistent;
            return this;
        }

        /**
         * Sets the header table. Values must not be null.
         *
         * @param headers the headers
         * @return this builder
         */
        public Builder headers(Map<String, ?> headers) {
            this.headers = headers == null ? null : new LinkedHashMap<>(headers);
            return this;
        }

        /**
         * Adds a single header.
         *
         * @param name  the header name
         * @param value the header value
         * @return this builder
         */
        public Builder header(String name, Object value) {
            if (this.headers == null) {
                this.headers = new LinkedHashMap<>();
            }
            this.headers.put(name, value);
            return this;
        }

        /**
         * Sets the serialized payload. <b>Required.</b>
         *
         * @param payload the payload bytes
         * @return this builder
         */
        public Builder payload(byte[] payload) {
            this.payload = payload;
            return this;
        }

        /**
         * Builds the envelope.
         *
         * @return a new envelope
         * @throws NullPointerException     if the routing key is null
         * @throws IllegalArgumentException if the payload is missing or too large, or a header is null
         */
        public Envelope build() {
            return new Envelope(this);
        }
    }
}
