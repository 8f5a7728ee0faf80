/**
 * Event loop and executor factories.
 * <p><strong>Role:</strong> Infrastructure adapter implementing
 * {@link io.lexlink.courier.application.port.SchedulerPort} on a single named daemon thread.</p>
 * <p><strong>Concurrency:</strong> All conversation state mutation happens on this one thread.</p>
 */
package io.lexlink.courier.infrastructure.exec;
