/**
 * Replays recorded XST data as if a station were writing it live, for end-to-end testing without hardware.
 */
package org.lofarimaging.realtime.application.simulate;
