/**
 * Pure Java value types shared across all Relay modules.
 *
 * <p>Job lifecycle states and backend output kinds live here so the broker,
 * the worker and the HTTP layer agree on their wire labels.
 * This module has no framework dependencies.
 */
package com.libragraph.relay.types;
