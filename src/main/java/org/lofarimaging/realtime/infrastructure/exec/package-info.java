/**
 * Executor factories for pipeline worker pools.
 * <p><strong>Role:</strong> Infrastructure utilities configuring the render pool and background schedulers.</p>
 * <p><strong>Concurrency:</strong> Factory methods are thread-safe and return managed executors.</p>
 * <p><strong>Performance:</strong> Bounded queues and named threads keep resource use predictable and diagnosable.</p>
 */
package org.lofarimaging.realtime.infrastructure.exec;
