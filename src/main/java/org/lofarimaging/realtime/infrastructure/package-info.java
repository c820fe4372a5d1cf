/**
 * Infrastructure adapters implementing the application ports: stream tailing, block archive, descriptor
 * parsing, renderer integration, metrics, and executors.
 */
package org.lofarimaging.realtime.infrastructure;
