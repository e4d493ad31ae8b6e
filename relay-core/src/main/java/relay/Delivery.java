package relay;

import relay.util.PayloadCodec;

import java.util.Map;
import java.util.Objects;

/**
 * A message handed to a {@link DeliveryCallback} by the subscriber.
 *
 * <p>A delivery is owned by exactly one worker until it is settled. The delivery tag
 * is only meaningful on the channel that produced it.
 */
public final class Delivery {
    private final long deliveryTag;
    private final boolean redelivered;
    private final String exchange;
    private final Envelope envelope;

    public Delivery(long deliveryTag, boolean redelivered, String exchange, Envelope envelope) {
        this.deliveryTag = deliveryTag;
        this.redelivered = redelivered;
        this.exchange = exchange == null ? "" : exchange;
        this.envelope = Objects.requireNonNull(envelope, "envelope");
    }

    public long deliveryTag() {
        return deliveryTag;
    }

    /**
     * Returns {@code true} if the broker has delivered this message before,
     * for example after a requeue or a lost connection.
     */
    public boolean redelivered() {
        return redelivered;
    }

    public String exchange() {
        return exchange;
    }

    public Envelope envelope() {
        return envelope;
    }

    public String routingKey() {
        return envelope.routingKey();
    }

    public byte[] body() {
        return envelope.payload();
    }

    public Map<String, Object> headers() {
        return envelope.headers();
    }

    public int attempt() {
        return envelope.attempt();
    }

    /**
     * Decodes the payload with the default JSON codec.
     *
     * @param type the target type
     * @param <T>  the target type
     * @return the decoded payload
     * @throws PayloadEncodingException if the payload cannot be decoded
     */
    public <T> T payloadAs(Class<T> type) {
        return payloadAs(type, PayloadCodec.json());
    }

    public <T> T payloadAs(Class<T> type, PayloadCodec codec) {
        return codec.decode(envelope.payload(), type);
    }

    @Override
    public String toString() {
        return "Delivery{tag=" + deliveryTag
                + ", routingKey=" + envelope.routingKey()
                + ", attempt=" + envelope.attempt()
                + ", redelivered=" + redelivered + '}';
    }
}
