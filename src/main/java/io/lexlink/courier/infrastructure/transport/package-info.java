/**
 * WebSocket transport adapter.
 * <p><strong>Role:</strong> Driven-side adapter implementing {@link io.lexlink.courier.application.port.TransportPort}.</p>
 * <p><strong>Concurrency:</strong> Callbacks run on JDK HTTP client threads and are re-dispatched by the caller.</p>
 * <p><strong>Security:</strong> Endpoints carry the bearer token in the query string; never log them unredacted.</p>
 */
package io.lexlink.courier.infrastructure.transport;
