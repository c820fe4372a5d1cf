/**
 * Logging helpers: runtime verbosity control and log-safe string handling.
 */
package org.lofarimaging.realtime.logging;
