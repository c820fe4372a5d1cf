/**
 * Block framing for the stream tailer: partial reads accumulate here until a whole block is available.
 */
package org.lofarimaging.realtime.infrastructure.buffer;
