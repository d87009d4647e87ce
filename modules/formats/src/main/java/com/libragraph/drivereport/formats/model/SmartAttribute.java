package com.libragraph.drivereport.formats.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.libragraph.drivereport.types.HealthStatus;

/**
 * Normalized SMART attribute. Numeric columns the report leaves blank are null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SmartAttribute(
        int id,
        String name,
        Long rawValue,
        Integer normalizedValue,
        Integer worst,
        Integer threshold,
        HealthStatus status
) {
}
