package relay.amqp;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;
import relay.BrokerConnectionException;
import relay.BrokerOperationException;
import relay.DeclarationException;
import relay.RelayException;
import relay.TopologyConflictException;

/**
 * Maps amqp-client failures onto the relay exception hierarchy.
 */
final class AmqpErrors {
  static final int NOT_FOUND = 404;
  static final int PRECONDITION_FAILED = 406;

  private AmqpErrors() {
  }

  /** Translates a failed declare or bind. */
  static RelayException declaration(String what, Exception e) {
    ShutdownSignalException signal = signalOf(e);
    if (signal != null && signal.isHardError()) {
      return new BrokerConnectionException("Connection lost while declaring " + what, e);
    }
    if (signal != null && replyCode(signal) == PRECONDITION_FAILED) {
      return new TopologyConflictException("Conflicting declaration of " + what + ": " + replyText(signal), e);
    }
    if (e instanceof AlreadyClosedException) {
      return new BrokerConnectionException("Channel closed while declaring " + what, e);
    }
    return new DeclarationException("Failed to declare " + what + ": " + describe(e, signal), e);
  }

  /** Translates any other channel operation failure. */
  static RelayException operation(String what, Exception e) {
    ShutdownSignalException signal = signalOf(e);
    if (signal != null && (signal.isHardError() || e instanceof AlreadyClosedException)) {
      return new BrokerConnectionException(what + " failed: " + describe(e, signal), e);
    }
    return new BrokerOperationException(what + " failed: " + describe(e, signal), e);
  }

  static String reason(ShutdownSignalException signal) {
    String text = replyText(signal);
    String scope = signal.isHardError() ? "connection" : "channel";
    return text != null ? scope + " closed: " + text : scope + " closed: " + signal.getMessage();
  }

  private static ShutdownSignalException signalOf(Throwable e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof ShutdownSignalException signal) {
        return signal;
      }
    }
    return null;
  }

  private static int replyCode(ShutdownSignalException signal) {
    Method reason = signal.getReason();
    if (reason instanceof AMQP.Channel.Close close) {
      return close.getReplyCode();
    }
    if (reason instanceof AMQP.Connection.Close close) {
      return close.getReplyCode();
    }
    return -1;
  }

  private static String replyText(ShutdownSignalException signal) {
    Method reason = signal.getReason();
    if (reason instanceof AMQP.Channel.Close close) {
      return close.getReplyText();
    }
    if (reason instanceof AMQP.Connection.Close close) {
      return close.getReplyText();
    }
    return null;
  }

  private static String describe(Exception e, ShutdownSignalException signal) {
    if (signal != null && replyText(signal) != null) {
      return replyText(signal);
    }
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
