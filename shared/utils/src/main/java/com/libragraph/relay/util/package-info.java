/**
 * Shared utilities for all Relay modules.
 *
 * <p>Contains {@link com.libragraph.relay.util.JobIds} (job identifier generation)
 * and {@link com.libragraph.relay.util.MediaTypes} (content type by file extension).
 * No framework dependencies, pure Java.
 */
package com.libragraph.relay.util;
