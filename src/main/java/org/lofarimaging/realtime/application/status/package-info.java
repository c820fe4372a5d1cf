/**
 * On-demand status snapshots and their periodic publication.
 */
package org.lofarimaging.realtime.application.status;
