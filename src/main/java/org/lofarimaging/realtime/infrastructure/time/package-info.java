/**
 * Clock adapters. Block timestamps and observation directory names are taken from here, always in UTC.
 */
package org.lofarimaging.realtime.infrastructure.time;
