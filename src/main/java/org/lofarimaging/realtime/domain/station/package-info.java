/**
 * Station description: station class, RCU count, and the imaging geometry derived from it.
 */
package org.lofarimaging.realtime.domain.station;
