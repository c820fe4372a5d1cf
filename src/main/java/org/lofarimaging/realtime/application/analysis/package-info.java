/**
 * Post-hoc analysis of archived block directories.
 */
package org.lofarimaging.realtime.application.analysis;
