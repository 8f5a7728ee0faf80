/**
 * JSON encoding of conversation frames.
 * <p><strong>Role:</strong> Application layer helper; built on the Jackson streaming API.</p>
 * <p><strong>Concurrency:</strong> Codec instances are stateless and may be shared.</p>
 */
package io.lexlink.courier.application.protocol;
