/**
 * Client configuration and composition root wiring for Courier CLIs.
 * <p><strong>Role:</strong> Bootstrap layer selecting transport, history and metrics adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Credentials are never part of {@link io.lexlink.courier.config.ClientConfig}; they
 * travel in {@link io.lexlink.courier.domain.conversation.ConversationIdentity}.</p>
 */
package io.lexlink.courier.config;
