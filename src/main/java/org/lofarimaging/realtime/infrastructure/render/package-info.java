/**
 * Renderer adapters: an external imaging process and a disabled stand-in.
 * <p><strong>Concurrency:</strong> Adapters are invoked concurrently from render workers; each call uses its own
 * scratch files.</p>
 */
package org.lofarimaging.realtime.infrastructure.render;
