package relay.amqp;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.client.impl.AMQImpl;
import org.junit.jupiter.api.Test;
import relay.BrokerConnectionException;
import relay.BrokerOperationException;
import relay.DeclarationException;
import relay.TopologyConflictException;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class AmqpErrorsTest {

  private static IOException channelClose(int code, String text) {
    ShutdownSignalException signal = new ShutdownSignalException(false, false,
        new AMQImpl.Channel.Close(code, text, 50, 10), null);
    return new IOException(signal);
  }

  @Test
  void preconditionFailedIsConflict() {
    var error = AmqpErrors.declaration("queue 'analysis'",
        channelClose(406, "PRECONDITION_FAILED - inequivalent arg 'x-message-ttl'"));

    assertInstanceOf(TopologyConflictException.class, error);
    assertTrue(error.getMessage().contains("x-message-ttl"));
  }

  @Test
  void notFoundIsDeclarationFailure() {
    var error = AmqpErrors.declaration("binding", channelClose(404, "NOT_FOUND - no exchange 'x'"));

    assertInstanceOf(DeclarationException.class, error);
    assertFalse(error instanceof TopologyConflictException);
  }

  @Test
  void hardErrorIsConnectionFailure() {
    ShutdownSignalException signal = new ShutdownSignalException(true, false,
        new AMQImpl.Connection.Close(320, "CONNECTION_FORCED", 0, 0), null);

    assertInstanceOf(BrokerConnectionException.class, AmqpErrors.operation("basic.ack", new IOException(signal)));
    assertInstanceOf(BrokerConnectionException.class, AmqpErrors.declaration("queue", new IOException(signal)));
  }

  @Test
  void closedChannelIsConnectionFailure() {
    AlreadyClosedException closed = new AlreadyClosedException(new ShutdownSignalException(false, true,
        new AMQImpl.Channel.Close(200, "OK", 0, 0), null));

    assertInstanceOf(BrokerConnectionException.class, AmqpErrors.operation("basic.ack", closed));
  }

  @Test
  void otherFailuresAreOperationFailures() {
    var error = AmqpErrors.operation("basic.reject", new IOException("broken pipe"));

    assertInstanceOf(BrokerOperationException.class, error);
    assertTrue(error.getMessage().contains("broken pipe"));
  }

  @Test
  void reasonNamesScope() {
    ShutdownSignalException signal = new ShutdownSignalException(true, false,
        new AMQImpl.Connection.Close(320, "CONNECTION_FORCED - shutdown", 0, 0), null);

    assertEquals("connection closed: CONNECTION_FORCED - shutdown", AmqpErrors.reason(signal));
  }
}
