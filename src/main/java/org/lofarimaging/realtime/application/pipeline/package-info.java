/**
 * Application pipelines that run an observation: the producer loop, the render dispatcher, the start/stop
 * control surface, and the renderer warm-up.
 * <p>The producer loop reads, archives, and decimates blocks in strict arrival order on one thread; surviving
 * blocks go to a bounded render pool whose submissions block when the queue is full. Worker threads follow the
 * {@code render-*} naming convention.</p>
 * <p>Operational counters are surfaced via {@link org.lofarimaging.realtime.application.port.MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package org.lofarimaging.realtime.application.pipeline;
