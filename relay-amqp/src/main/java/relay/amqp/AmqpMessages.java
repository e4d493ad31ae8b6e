package relay.amqp;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.LongString;
import relay.Delivery;
import relay.Envelope;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between relay envelopes and amqp-client message properties.
 *
 * <p>String header values arrive from the broker as {@link LongString}; they are turned
 * back into {@link String}s, recursively for nested tables and arrays.
 */
final class AmqpMessages {
  static final int PERSISTENT = 2;
  static final int TRANSIENT = 1;

  private AmqpMessages() {
  }

  static AMQP.BasicProperties toProperties(Envelope envelope) {
    return new AMQP.BasicProperties.Builder()
        .contentType(envelope.contentType())
        .deliveryMode(envelope.persistent() ? PERSISTENT : TRANSIENT)
        .messageId(envelope.messageId())
        .timestamp(Date.from(envelope.timestamp()))
        .headers(envelope.headers().isEmpty() ? null : new LinkedHashMap<>(envelope.headers()))
        .build();
  }

  static Envelope toEnvelope(String routingKey, AMQP.BasicProperties properties, byte[] body) {
    Envelope.Builder builder = Envelope.builder(routingKey).payload(body == null ? new byte[0] : body);
    if (properties == null) {
      return builder.build();
    }
    if (properties.getMessageId() != null) {
      builder.messageId(properties.getMessageId());
    }
    if (properties.getTimestamp() != null) {
      builder.timestamp(properties.getTimestamp().toInstant());
    }
    if (properties.getContentType() != null) {
      builder.contentType(properties.getContentType());
    }
    Integer mode = properties.getDeliveryMode();
    builder.persistent(mode == null || mode == PERSISTENT);
    if (properties.getHeaders() != null) {
      Map<String, Object> headers = new LinkedHashMap<>();
      properties.getHeaders().forEach((name, value) -> {
        if (name != null && value != null) {
          headers.put(name, fromWire(value));
        }
      });
      builder.headers(headers);
    }
    return builder.build();
  }

  static Delivery toDelivery(com.rabbitmq.client.Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
    return new Delivery(envelope.getDeliveryTag(), envelope.isRedeliver(), envelope.getExchange(),
        toEnvelope(envelope.getRoutingKey(), properties, body));
  }

  private static Object fromWire(Object value) {
    if (value instanceof LongString s) {
      return s.toString();
    }
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      map.forEach((k, v) -> {
        if (k != null && v != null) {
          copy.put(k.toString(), fromWire(v));
        }
      });
      return copy;
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(item == null ? null : fromWire(item));
      }
      return copy;
    }
    return value;
  }
}
