/**
 * Jackson streaming helpers shared by the JSON adapters.
 */
package org.lofarimaging.realtime.infrastructure.json;
