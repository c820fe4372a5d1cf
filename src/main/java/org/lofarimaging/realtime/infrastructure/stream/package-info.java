/**
 * Adapters for the station's append-only XST stream file.
 * <p><strong>Role:</strong> Implement {@link org.lofarimaging.realtime.application.port.StreamSourceLocator} and
 * {@link org.lofarimaging.realtime.application.port.BlockSource}.</p>
 * <p><strong>Concurrency:</strong> Each tailer is polled by one producer thread.</p>
 * <p><strong>Metrics:</strong> Emits {@code observe.stream.*} counters.</p>
 */
package org.lofarimaging.realtime.infrastructure.stream;
