/**
 * Shared live state of the running observation.
 * <p><strong>Concurrency:</strong> {@link org.lofarimaging.realtime.application.state.ObservationState} guards its
 * fields with one lock and {@link org.lofarimaging.realtime.application.state.TrackingHistory} with another; the two
 * are never held together.</p>
 */
package org.lofarimaging.realtime.application.state;
