package com.libragraph.drivereport.formats.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.libragraph.drivereport.types.HealthStatus;
import com.libragraph.drivereport.types.InterfaceType;
import com.libragraph.drivereport.types.SourceFormat;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One physical drive's diagnostic snapshot in the canonical schema.
 *
 * <p>{@code serialNumber} is never empty. {@code capacityBytes} is 0 when the report states no
 * capacity; the boxed fields are null when the report does not carry them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CanonicalDriveRecord(
        String serialNumber,
        String model,
        InterfaceType interfaceType,
        long capacityBytes,
        HealthStatus overallHealth,
        Integer temperatureCelsius,
        Long powerOnHours,
        SortedMap<Integer, SmartAttribute> smartAttributes,
        String sourceFileName,
        SourceFormat sourceFormat,
        Instant extractedAt,
        String rawExcerpt,
        Integer healthScore,
        Long reallocatedSectors,
        Long grownDefects,
        String vendorInformation,
        String sourceHash
) {
    private static final int LABEL_SERIAL_LENGTH = 8;

    public CanonicalDriveRecord {
        Objects.requireNonNull(serialNumber, "serialNumber cannot be null");
        if (serialNumber.isBlank()) {
            throw new IllegalArgumentException("serialNumber cannot be empty");
        }
        if (capacityBytes < 0) {
            throw new IllegalArgumentException("capacityBytes cannot be negative: " + capacityBytes);
        }
        model = model == null ? "" : model;
        interfaceType = interfaceType == null ? InterfaceType.UNKNOWN : interfaceType;
        overallHealth = overallHealth == null ? HealthStatus.UNKNOWN : overallHealth;
        smartAttributes = smartAttributes == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(smartAttributes));
        vendorInformation = vendorInformation == null ? "" : vendorInformation;
        rawExcerpt = rawExcerpt == null ? "" : rawExcerpt;
        Objects.requireNonNull(sourceFileName, "sourceFileName cannot be null");
        Objects.requireNonNull(sourceFormat, "sourceFormat cannot be null");
        Objects.requireNonNull(extractedAt, "extractedAt cannot be null");
    }

    /** Serial as printed on the drive label: its first eight characters. */
    public String labelSerial() {
        return serialNumber.length() <= LABEL_SERIAL_LENGTH
                ? serialNumber
                : serialNumber.substring(0, LABEL_SERIAL_LENGTH);
    }

    public DriveVendor vendor() {
        return DriveVendor.fromModel(model);
    }

    /**
     * Number of populated descriptive fields; ranks duplicates during reconciliation.
     */
    public int completeness() {
        int count = 0;
        if (!model.isEmpty()) count++;
        if (interfaceType != InterfaceType.UNKNOWN) count++;
        if (capacityBytes > 0) count++;
        if (overallHealth.isKnown()) count++;
        if (temperatureCelsius != null) count++;
        if (powerOnHours != null) count++;
        if (!smartAttributes.isEmpty()) count++;
        if (healthScore != null) count++;
        if (reallocatedSectors != null) count++;
        if (grownDefects != null) count++;
        if (!vendorInformation.isEmpty()) count++;
        return count;
    }

    public static Builder builder(String serialNumber) {
        return new Builder(serialNumber);
    }

    public static final class Builder {
        private final String serialNumber;
        private String model;
        private InterfaceType interfaceType;
        private long capacityBytes;
        private HealthStatus overallHealth;
        private Integer temperatureCelsius;
        private Long powerOnHours;
        private SortedMap<Integer, SmartAttribute> smartAttributes;
        private String sourceFileName;
        private SourceFormat sourceFormat;
        private Instant extractedAt;
        private String rawExcerpt;
        private Integer healthScore;
        private Long reallocatedSectors;
        private Long grownDefects;
        private String vendorInformation;
        private String sourceHash;

        private Builder(String serialNumber) {
            this.serialNumber = serialNumber;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder interfaceType(InterfaceType interfaceType) {
            this.interfaceType = interfaceType;
            return this;
        }

        public Builder capacityBytes(long capacityBytes) {
            this.capacityBytes = capacityBytes;
            return this;
        }

        public Builder overallHealth(HealthStatus overallHealth) {
            this.overallHealth = overallHealth;
            return this;
        }

        public Builder temperatureCelsius(Integer temperatureCelsius) {
            this.temperatureCelsius = temperatureCelsius;
            return this;
        }

        public Builder powerOnHours(Long powerOnHours) {
            this.powerOnHours = powerOnHours;
            return this;
        }

        public Builder smartAttributes(Map<Integer, SmartAttribute> smartAttributes) {
            this.smartAttributes = smartAttributes == null ? null : new TreeMap<>(smartAttributes);
            return this;
        }

        public Builder sourceFileName(String sourceFileName) {
            this.sourceFileName = sourceFileName;
            return this;
        }

        public Builder sourceFormat(SourceFormat sourceFormat) {
            this.sourceFormat = sourceFormat;
            return this;
        }

        public Builder extractedAt(Instant extractedAt) {
            this.extractedAt = extractedAt;
            return this;
        }

        public Builder rawExcerpt(String rawExcerpt) {
            this.rawExcerpt = rawExcerpt;
            return this;
        }

        public Builder healthScore(Integer healthScore) {
            this.healthScore = healthScore;
            return this;
        }

        public Builder reallocatedSectors(Long reallocatedSectors) {
            this.reallocatedSectors = reallocatedSectors;
            return this;
        }

        public Builder grownDefects(Long grownDefects) {
            this.grownDefects = grownDefects;
            return this;
        }

        public Builder vendorInformation(String vendorInformation) {
            this.vendorInformation = vendorInformation;
            return this;
        }

        public Builder sourceHash(String sourceHash) {
            this.sourceHash = sourceHash;
            return this;
        }

        public CanonicalDriveRecord build() {
            return new CanonicalDriveRecord(serialNumber, model, interfaceType, capacityBytes, overallHealth,
                    temperatureCelsius, powerOnHours, smartAttributes, sourceFileName, sourceFormat,
                    extractedAt, rawExcerpt, healthScore, reallocatedSectors, grownDefects,
                    vendorInformation, sourceHash);
        }
    }
}
