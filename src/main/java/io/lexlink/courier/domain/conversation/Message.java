package io.lexlink.courier.domain.conversation;

import java.util.Objects;

/**
 * <strong>What:</strong> Immutable chat message exchanged inside one conversation.
 * <p><strong>Why:</strong> The message log is keyed by {@link #id()}; two records with the same id are the same
 * logical message even when their read flags differ.</p>
 * <p><strong>Thread-safety:</strong> Records are immutable and safe to share across threads.</p>
 *
 * @param id opaque identifier, unique within a conversation; never {@code null}
 * @param senderId numeric id of the author (user id or lawyer id)
 * @param senderRole side of the conversation that authored the message; never {@code null}
 * @param text message body; never {@code null}
 * @param timestamp ISO-8601 creation time as sent by the server; never {@code null}
 * @param readByClient whether the client side has read the message
 * @param readByCounterpart whether the counterpart side has read the message
 *
 * @since 1.0.0
 */
public record Message(
    String id,
    long senderId,
    SenderRole senderRole,
    String text,
    String timestamp,
    boolean readByClient,
    boolean readByCounterpart) {

  /**
   * Validates constructor invariants.
   */
  public Message {
    id = Objects.requireNonNull(id, "id");
    senderRole = Objects.requireNonNull(senderRole, "senderRole");
    text = Objects.requireNonNull(text, "text");
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
  }

  /**
   * Returns a copy with the read flag of {@code reader} set.
   *
   * @param reader side that acknowledged the message
   * @return this instance when the flag is already set, otherwise a patched copy
   */
  public Message withReadBy(SenderRole reader) {
    Objects.requireNonNull(reader, "reader");
    if (isReadBy(reader)) {
      return this;
    }
    return reader == SenderRole.CLIENT
        ? new Message(id, senderId, senderRole, text, timestamp, true, readByCounterpart)
        : new Message(id, senderId, senderRole, text, timestamp, readByClient, true);
  }

  /**
   * Indicates whether {@code reader} has acknowledged this message.
   *
   * @param reader side to check
   * @return {@code true} when the matching read flag is set
   */
  public boolean isReadBy(SenderRole reader) {
    return reader == SenderRole.CLIENT ? readByClient : readByCounterpart;
  }
}
