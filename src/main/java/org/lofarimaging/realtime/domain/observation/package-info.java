/**
 * Observation session layout on disk.
 */
package org.lofarimaging.realtime.domain.observation;
