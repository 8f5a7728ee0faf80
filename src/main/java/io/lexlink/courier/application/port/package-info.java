/**
 * <strong>Purpose:</strong> Ports between the conversation components and the outside world.
 * <p><strong>Role:</strong> Domain layer; adapters in {@code infrastructure} implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Transport callbacks may arrive on any thread; everything else is driven from the
 * {@link io.lexlink.courier.application.port.SchedulerPort} event loop.</p>
 * <p><strong>Security:</strong> Credentials cross these boundaries only inside
 * {@link io.lexlink.courier.domain.conversation.ConversationIdentity} and composed endpoints.</p>
 *
 * @since 1.0.0
 */
package io.lexlink.courier.application.port;
