/**
 * Correlation block primitives: framed XST matrices, subband ranges, and the archive naming contract.
 * <p><strong>Role:</strong> Domain types shared by the stream tailer, the block archive, and the analyzer.</p>
 * <p><strong>Concurrency:</strong> Records are immutable; helpers are stateless.</p>
 */
package org.lofarimaging.realtime.domain.block;
