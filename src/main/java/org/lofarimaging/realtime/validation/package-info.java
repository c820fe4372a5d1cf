/**
 * <strong>Purpose:</strong> Validation helpers used while parsing CLI arguments and YAML configuration.
 * <p><strong>Role:</strong> Rejects bad thread counts, steps, subband bounds, station names and directories
 * before an observation allocates threads or opens the stream.</p>
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.</p>
 * <p><strong>Observability:</strong> No logging; failures surface as {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
package org.lofarimaging.realtime.validation;
