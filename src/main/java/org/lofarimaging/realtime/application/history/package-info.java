/**
 * Read-only view over the session logs of past observations.
 */
package org.lofarimaging.realtime.application.history;
