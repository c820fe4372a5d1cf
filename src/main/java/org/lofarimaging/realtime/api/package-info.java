/**
 * CLI entry points for observing, browsing past observations, analysing archived blocks and simulating a
 * station stream.
 * <p><strong>Role:</strong> Driving adapters; they parse arguments, configure logging and telemetry, and invoke
 * use cases.</p>
 * <p><strong>Concurrency:</strong> Commands set up on the main thread; the observation runs on its own thread.</p>
 */
package org.lofarimaging.realtime.api;
