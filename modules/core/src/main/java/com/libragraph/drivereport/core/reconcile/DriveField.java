package com.libragraph.drivereport.core.reconcile;

import com.libragraph.drivereport.formats.model.CanonicalDriveRecord;
import com.libragraph.drivereport.formats.model.SmartAttribute;
import com.libragraph.drivereport.types.HealthStatus;
import com.libragraph.drivereport.types.InterfaceType;

import java.util.Map;
import java.util.Optional;

/**
 * Descriptive fields of a {@link CanonicalDriveRecord} that are merged field by field.
 * Identity and provenance fields (serial, source file, format, timestamp, excerpt, hash)
 * are not listed; the merged record takes them from its primary source.
 */
public enum DriveField {
    MODEL {
        @Override
        public Object value(CanonicalDriveRecord record) {
            return record.model();
        }

        @Override
        public boolean isPopulated(CanonicalDriveRecord record) {
            return !record.model().isEmpty();
        }

        @Override
        void copy(CanonicalDriveRecord from, CanonicalDriveRecord.Builder to) {
            to.model(from.model());
        }
    },
    INTERFACE_TYPE {
        @Override
        public Object value(CanonicalDriveRecord record) {
            return record.interfaceType();
        }

        @Override
        public boolean isPopulated(CanonicalDriveRecord record) {
            return record.interfaceType() != InterfaceType.UNKNOWN;
        }

        @Override
        void copy(CanonicalDriveRecord from, CanonicalDriveRecord.Builder to) {
            to.interfaceType(from.interfaceType());
        }
    },
    CAPACITY_BYTES {
        @Override
        public Object value(CanonicalDriveRecord record) {
            return record.capacityBytes();
        }

        @Override
        public boolean isPopulated(CanonicalDriveRecord record) {
            return record.capacityBytes() > 0;
        }

        @Override
        void copy(CanonicalDriveRecord from, CanonicalDriveRecord.Builder to) {
            to.capacityBytes(from.capacityBytes());
        }
    },
    OVERALL_HEALTH {
        @Override
        public Object value(CanonicalDriveRecord record) {
            return record.overallHealth();
        }

        @Override
        public boolean isPopulated(CanonicalDriveRecord record) {
            return record.overallHealth() != HealthStatus.UNKNOWN;
        }

        @Override
        void copy(CanonicalDriveRecord from, CanonicalDriveRecord.Builder to) {
            to.overallHealth(from.overallHealth());
        }
    },
    HEALTH_SCORE {
        @Override
        public Optional<DriveField> resolvedWith() {
            return Optional.of(OVERALL_HEALTH);
        }

        @Override
        public Object value(CanonicalDriveRecord record) {
            return record.healthScore();
        }

        @Override
        void copy(CanonicalDriveRecord from, CanonicalDriveRecord.Builder to) {
            to.healthScore(from.healthScore());
        }
    },
    TEMPERATURE_CELSIUS {
        @Override
        public Object value(CanonicalDriveRecord record) {
            return record.temperatureCelsius();
        }

        @Override
        void copy(CanonicalDriveRecord from, CanonicalDriveRecord.Builder to) {
            to.temperatureCelsius(from.temperatureCelsius());
        }
    },
    POWER_ON_HOURS {
        @Override
        public Object value(CanonicalDriveRecord record) {
            return record.powerOnHours();
        }

        @Override
        void copy(CanonicalDriveRecord from, CanonicalDriveRecord.Builder to) {
            to.powerOnHours(from.powerOnHours());
        }
    },
    REALLOCATED_SECTORS {
        @Override
        public Object value(CanonicalDriveRecord record) {
            return record.reallocatedSectors();
        }

        @Override
        void copy(CanonicalDriveRecord from, CanonicalDriveRecord.Builder to) {
            to.reallocatedSectors(from.reallocatedSectors());
        }
    },
    GROWN_DEFECTS {
        @Override
        public Object value(CanonicalDriveRecord record) {
            return record.grownDefects();
        }

        @Override
        void copy(CanonicalDriveRecord from, CanonicalDriveRecord.Builder to) {
            to.grownDefects(from.grownDefects());
        }
    },
    VENDOR_INFORMATION {
        @Override
        public Object value(CanonicalDriveRecord record) {
            return record.vendorInformation();
        }

        @Override
        public boolean isPopulated(CanonicalDriveRecord record) {
            return !record.vendorInformation().isEmpty();
        }

        @Override
        void copy(CanonicalDriveRecord from, CanonicalDriveRecord.Builder to) {
            to.vendorInformation(from.vendorInformation());
        }
    },
    SMART_ATTRIBUTES {
        @Override
        public Object value(CanonicalDriveRecord record) {
            return record.smartAttributes();
        }

        @Override
        public boolean isPopulated(CanonicalDriveRecord record) {
            return !record.smartAttributes().isEmpty();
        }

        @Override
        public String render(CanonicalDriveRecord record) {
            StringBuilder sb = new StringBuilder();
            for (Map.Entry<Integer, SmartAttribute> entry : record.smartAttributes().entrySet()) {
                if (sb.length() > 0) {
                    sb.append(", ");
                }
                sb.append(entry.getKey()).append('=').append(entry.getValue().rawValue());
            }
            return sb.toString();
        }

        @Override
        void copy(CanonicalDriveRecord from, CanonicalDriveRecord.Builder to) {
            to.smartAttributes(from.smartAttributes());
        }
    };

    public abstract Object value(CanonicalDriveRecord record);

    /** Boxed fields are populated when non-null; the others override this. */
    public boolean isPopulated(CanonicalDriveRecord record) {
        return value(record) != null;
    }

    /** Display form used in conflict annotations. */
    public String render(CanonicalDriveRecord record) {
        return String.valueOf(value(record));
    }

    /**
     * Field whose chosen member also supplies this one, when the two must not be mixed across
     * members.
     */
    public Optional<DriveField> resolvedWith() {
        return Optional.empty();
    }

    abstract void copy(CanonicalDriveRecord from, CanonicalDriveRecord.Builder to);
}
