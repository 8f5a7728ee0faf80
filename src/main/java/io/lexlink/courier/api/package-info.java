/**
 * Command-line entry points: the {@code courier} dispatcher, the console chat client and the endpoint resolver.
 * <p><strong>Concurrency:</strong> The console thread only reads input; every manager call is queued onto the
 * event loop.</p>
 * <p><strong>Security:</strong> Tokens are accepted as arguments but printed and logged only in redacted form.</p>
 */
package io.lexlink.courier.api;
