/**
 * Conversation domain types: messages, roles, identity, connection states and error taxonomy.
 * <p><strong>Role:</strong> Domain layer; free of transport and framework dependencies.</p>
 * <p><strong>Concurrency:</strong> All types are immutable.</p>
 */
package io.lexlink.courier.domain.conversation;
