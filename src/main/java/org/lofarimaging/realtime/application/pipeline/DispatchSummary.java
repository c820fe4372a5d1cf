package org.lofarimaging.realtime.application.pipeline;

/**
 * Counters accumulated by a {@link RenderDispatcher} over one observation.
 *
 * @param offered blocks offered
 * @param decimated blocks skipped by the decimation step
 * @param discarded blocks discarded at the pre-submission shutdown check
 * @param submitted tasks handed to the pool
 * @param rejected tasks refused by the pool
 * @param completed tasks that rendered successfully
 * @param failed tasks whose render threw
 * @param cancelled tasks that saw the stop request before rendering
 * @param lastFailure message of the most recent failure, or {@code null}
 * @since 0.1.0
 */
public record DispatchSummary(
    long offered,
    long decimated,
    long discarded,
    long submitted,
    long rejected,
    long completed,
    long failed,
    long cancelled,
    String lastFailure) {}
