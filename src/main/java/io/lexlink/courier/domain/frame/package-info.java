/**
 * Wire frames exchanged with the conversation server, independent of their JSON encoding.
 */
package io.lexlink.courier.domain.frame;
