/**
 * Configuration aggregates and composition root wiring for the observation CLIs.
 * <p><strong>Role:</strong> Bootstrap layer that merges defaults, YAML and CLI values, validates them, and
 * selects the renderer, metrics and persistence adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 */
package org.lofarimaging.realtime.config;
