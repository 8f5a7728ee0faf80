package io.lexlink.courier.domain.frame;

import java.util.List;
import java.util.Objects;

/**
 * Client-to-server frame.
 *
 * @since 1.0.0
 */
public sealed interface OutboundFrame
    permits OutboundFrame.SendMessage, OutboundFrame.Typing, OutboundFrame.MarkRead {

  /**
   * Returns the wire {@code type} discriminator.
   *
   * @return frame type understood by the server
   */
  String type();

  /**
   * Posts a chat message.
   *
   * @param text trimmed, non-blank message body
   */
  record SendMessage(String text) implements OutboundFrame {
    public SendMessage {
      text = Objects.requireNonNull(text, "text");
    }

    @Override
    public String type() {
      return "send_message";
    }
  }

  /**
   * Local typing state change.
   *
   * @param typing whether the local user is typing
   */
  record Typing(boolean typing) implements OutboundFrame {
    @Override
    public String type() {
      return "typing";
    }
  }

  /**
   * Marks messages as read; an empty id list means "everything in the conversation".
   *
   * @param messageIds explicit ids to acknowledge; never {@code null}
   */
  record MarkRead(List<String> messageIds) implements OutboundFrame {
    /** Acknowledges every message in the conversation. */
    public static final MarkRead ALL = new MarkRead(List.of());

    public MarkRead {
      messageIds = messageIds == null ? List.of() : List.copyOf(messageIds);
    }

    @Override
    public String type() {
      return "mark_read";
    }
  }
}
