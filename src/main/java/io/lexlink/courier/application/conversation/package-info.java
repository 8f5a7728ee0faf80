/**
 * Real-time conversation transport: reconnect policy, deduplication, typing throttle, connection manager,
 * lifecycle coordinator and the observable state store.
 * <p><strong>Role:</strong> Application layer; talks to the network only through
 * {@link io.lexlink.courier.application.port.TransportPort}.</p>
 * <p><strong>Concurrency:</strong> Every component here is confined to one cooperative event loop
 * ({@link io.lexlink.courier.application.port.SchedulerPort}); the state store publishes immutable snapshots for
 * readers on other threads.</p>
 * <p><strong>Metrics:</strong> Connection lifecycle and frame counters are emitted under {@code conversation.*}.</p>
 * <p><strong>Security:</strong> Credentials are embedded only in the composed endpoint and never logged.</p>
 */
package io.lexlink.courier.application.conversation;
