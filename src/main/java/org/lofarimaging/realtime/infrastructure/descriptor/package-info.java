/**
 * Observation descriptor parsing ({@code .h}/{@code .sh} files written alongside the XST stream).
 */
package org.lofarimaging.realtime.infrastructure.descriptor;
