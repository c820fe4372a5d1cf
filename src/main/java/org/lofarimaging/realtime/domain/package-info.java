/**
 * Core domain model for the LOFAR realtime acquire → dispatch → render pipeline.
 * <p><strong>Role:</strong> Domain layer values describing correlation blocks, stations, observation
 * sessions, and live status without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 * <p><strong>Metrics:</strong> Domain attributes feed tagging on {@code observe.*} metrics.</p>
 */
package org.lofarimaging.realtime.domain;
