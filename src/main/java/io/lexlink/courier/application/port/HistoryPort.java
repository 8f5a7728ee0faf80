package io.lexlink.courier.application.port;

import io.lexlink.courier.domain.conversation.ConversationIdentity;
import io.lexlink.courier.domain.conversation.Message;
import java.io.IOException;
import java.util.List;

/**
 * Port supplying the persisted message history used to seed the conversation state.
 *
 * @since 1.0.0
 */
public interface HistoryPort {

  /**
   * Fetches the messages stored for the identity's conversation.
   *
   * @param identity complete identity; the credential authorizes the request
   * @return messages in server order
   * @throws IOException when the history cannot be retrieved or decoded
   */
  List<Message> fetchHistory(ConversationIdentity identity) throws IOException;

  /**
   * History source that always returns an empty list.
   */
  HistoryPort NONE = identity -> List.of();
}
