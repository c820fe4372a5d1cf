/**
 * File-system adapters for the observation directory: block artifacts, the session log, and the status
 * document.
 * <p><strong>Concurrency:</strong> Adapters are stateless apart from their JSON factory and safe to share.</p>
 * <p><strong>Security:</strong> Writes stay inside the observation directory handed in by the caller.</p>
 */
package org.lofarimaging.realtime.infrastructure.persistence;
