/**
 * Live status values: system status, image log entries, tracking samples, and the pure computations
 * (processing-time window, velocity estimate) behind the status snapshot.
 * <p><strong>Concurrency:</strong> Records are immutable. {@link org.lofarimaging.realtime.domain.status.ProcessingTimeWindow}
 * is mutable and must be guarded by its owner.</p>
 */
package org.lofarimaging.realtime.domain.status;
