/**
 * Logging utilities: redaction, truncation and runtime level control over SLF4J and Logback.
 * <p><strong>Security:</strong> Credentials must pass through {@link io.lexlink.courier.logging.Logs#redact(String)}
 * before reaching any log statement.</p>
 */
package io.lexlink.courier.logging;
