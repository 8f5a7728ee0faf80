/**
 * Validation helpers for configuration and CLI input.
 * <p><strong>Thread-safety:</strong> Stateless utilities.</p>
 */
package io.lexlink.courier.validation;
