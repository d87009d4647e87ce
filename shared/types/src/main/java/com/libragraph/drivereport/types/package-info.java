/**
 * Pure Java value types shared across all drive-report modules.
 *
 * <p>Closed enumerations for report formats, drive interfaces, health verdicts and
 * parse-error reasons. No framework dependencies.
 */
package com.libragraph.drivereport.types;
