package io.lexlink.courier.domain.frame;

import io.lexlink.courier.domain.conversation.Message;
import io.lexlink.courier.domain.conversation.SenderRole;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Decoded server-to-client frame.
 * <p><strong>Why:</strong> Gives the connection manager a single closed set of frame shapes to dispatch on.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records.</p>
 *
 * @since 1.0.0
 */
public sealed interface InboundFrame
    permits InboundFrame.ConnectionEstablished,
        InboundFrame.NewMessage,
        InboundFrame.TypingIndicator,
        InboundFrame.ReadReceipt,
        InboundFrame.ServerError,
        InboundFrame.Unknown {

  /**
   * Returns the wire {@code type} discriminator.
   *
   * @return frame type as sent by the server
   */
  String type();

  /**
   * Informational handshake acknowledgement.
   *
   * @param conversationId conversation echoed by the server; may be {@code null}
   * @param timestamp server time of the handshake; may be {@code null}
   */
  record ConnectionEstablished(String conversationId, String timestamp) implements InboundFrame {
    @Override
    public String type() {
      return "connection_established";
    }
  }

  /**
   * New or replayed message.
   *
   * @param message decoded message; never {@code null}
   */
  record NewMessage(Message message) implements InboundFrame {
    public NewMessage {
      message = Objects.requireNonNull(message, "message");
    }

    @Override
    public String type() {
      return "new_message";
    }
  }

  /**
   * Remote party started or stopped typing.
   *
   * @param role typing party when the server reports it; may be {@code null}
   * @param typing carried flag; absent values decode as {@code false}
   */
  record TypingIndicator(SenderRole role, boolean typing) implements InboundFrame {
    @Override
    public String type() {
      return "typing_indicator";
    }
  }

  /**
   * Read acknowledgement for a set of message ids.
   *
   * @param role acknowledging side, or {@code null} when the server sent an unknown role
   * @param messageIds acknowledged ids; never {@code null}
   */
  record ReadReceipt(SenderRole role, List<String> messageIds) implements InboundFrame {
    public ReadReceipt {
      messageIds = messageIds == null ? List.of() : List.copyOf(messageIds);
    }

    /**
     * Returns the acknowledging side when it is known.
     *
     * @return optional role
     */
    public Optional<SenderRole> reader() {
      return Optional.ofNullable(role);
    }

    @Override
    public String type() {
      return "read_receipt";
    }
  }

  /**
   * Server-side error report; does not close the connection by itself.
   *
   * @param error error text; never {@code null}
   */
  record ServerError(String error) implements InboundFrame {
    public ServerError {
      error = Objects.requireNonNull(error, "error");
    }

    @Override
    public String type() {
      return "error";
    }
  }

  /**
   * Frame with a type this client does not understand.
   *
   * @param type raw discriminator
   */
  record Unknown(String type) implements InboundFrame {}
}
