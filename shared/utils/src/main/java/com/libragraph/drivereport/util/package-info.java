/**
 * Shared utilities for all drive-report modules.
 *
 * <p>Contains {@link com.libragraph.drivereport.util.ContentHash} (BLAKE3-128 fingerprints of
 * source files) and {@link com.libragraph.drivereport.util.TextDecoding} (charset fallback for
 * report text). No framework dependencies, pure Java plus Commons Codec.
 */
package com.libragraph.drivereport.util;
