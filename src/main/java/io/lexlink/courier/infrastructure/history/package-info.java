/**
 * REST history adapter used to seed the conversation log before the live channel opens.
 */
package io.lexlink.courier.infrastructure.history;
