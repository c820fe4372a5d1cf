/**
 * <strong>Purpose:</strong> Ports defining the acquire → dispatch → render workflow contracts.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces to
 * reach the file system, the external renderer, and the metrics backend.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/logging but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package org.lofarimaging.realtime.application.port;
