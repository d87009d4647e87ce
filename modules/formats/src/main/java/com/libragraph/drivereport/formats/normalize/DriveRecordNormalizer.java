package com.libragraph.drivereport.formats.normalize;

import com.libragraph.drivereport.formats.api.RawDriveBlock;
import com.libragraph.drivereport.formats.api.RawSmartRow;
import com.libragraph.drivereport.formats.api.ReportField;
import com.libragraph.drivereport.formats.model.CanonicalDriveRecord;
import com.libragraph.drivereport.formats.model.ParseError;
import com.libragraph.drivereport.formats.model.SmartAttribute;
import com.libragraph.drivereport.types.HealthStatus;
import com.libragraph.drivereport.types.InterfaceType;
import com.libragraph.drivereport.types.ParseErrorReason;
import com.libragraph.drivereport.types.SourceFormat;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Coerces raw drive blocks into {@link CanonicalDriveRecord}s.
 *
 * <p>Values that cannot be read become UNKNOWN or absent. Only a missing serial number (any
 * dialect) or a missing health line (HTML dialect) rejects a block. The wall clock is never
 * read: {@code extractedAt} falls back from the report date to the dialect timestamp, then to
 * the source modification time, then to {@link Instant#EPOCH}.
 */
@ApplicationScoped
public class DriveRecordNormalizer {

    static final int ATTR_REALLOCATED_SECTORS = 5;
    static final int ATTR_POWER_ON_HOURS = 9;
    static final int ATTR_AIRFLOW_TEMPERATURE = 190;
    static final int ATTR_TEMPERATURE = 194;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern REPEATED_SUFFIX = Pattern.compile("([A-Z0-9]{2,4})\\1+$");
    private static final int REPEATED_SUFFIX_MIN_LENGTH = 12;
    private static final Set<String> PLACEHOLDER_SERIALS = Set.of("N/A", "NA", "NONE", "UNKNOWN", "-", "?");

    private static final Pattern HEX_DIGITS = Pattern.compile("^(?:0[xX])?([0-9A-Fa-f]+)$");
    private static final Pattern DECIMAL = Pattern.compile("\\d+");

    private final ReportTimestamps timestamps;

    @Inject
    public DriveRecordNormalizer(
            @ConfigProperty(name = "drivereport.timestamps.zone", defaultValue = "UTC") String zone) {
        this.timestamps = new ReportTimestamps(ZoneId.of(zone));
    }

    public NormalizedOutcome normalize(RawDriveBlock block) {
        String serial = normalizeSerial(block.field(ReportField.SERIAL).orElse(null), block.format());
        if (serial == null) {
            return rejected(block, "Drive block has no serial number");
        }
        if (block.format() == SourceFormat.HTML && !block.has(ReportField.HEALTH)) {
            return rejected(block, "Drive section has no health line");
        }

        SortedMap<Integer, SmartAttribute> smart = new TreeMap<>();
        for (RawSmartRow row : block.smartRows()) {
            smart.putIfAbsent(row.id(), smartAttribute(row));
        }

        FieldValues.HealthReading health = FieldValues.health(block.field(ReportField.HEALTH).orElse(null));

        Integer temperature = block.field(ReportField.TEMPERATURE)
                .map(FieldValues::temperatureCelsius)
                .orElse(null);
        if (temperature == null) {
            temperature = smartRaw(smart, ATTR_TEMPERATURE)
                    .or(() -> smartRaw(smart, ATTR_AIRFLOW_TEMPERATURE))
                    .map(Long::intValue)
                    .orElse(null);
        }

        Long powerOn = block.field(ReportField.POWER_ON).map(FieldValues::powerOnHours).orElse(null);
        if (powerOn == null) {
            powerOn = smartRaw(smart, ATTR_POWER_ON_HOURS).orElse(null);
        }

        Long reallocated = block.field(ReportField.REALLOCATED_SECTORS).map(FieldValues::count).orElse(null);
        if (reallocated == null) {
            reallocated = smartRaw(smart, ATTR_REALLOCATED_SECTORS).orElse(null);
        }

        CanonicalDriveRecord record = CanonicalDriveRecord.builder(serial)
                .model(singleLine(block.field(ReportField.MODEL).orElse("")))
                .interfaceType(InterfaceType.fromDescription(block.field(ReportField.INTERFACE).orElse(null)))
                .capacityBytes(FieldValues.capacityBytes(block.field(ReportField.CAPACITY).orElse(null)))
                .overallHealth(health.status())
                .healthScore(health.score())
                .temperatureCelsius(temperature)
                .powerOnHours(powerOn)
                .reallocatedSectors(reallocated)
                .grownDefects(block.field(ReportField.GROWN_DEFECTS).map(FieldValues::count).orElse(null))
                .vendorInformation(singleLine(block.field(ReportField.VENDOR_INFORMATION).orElse("")))
                .smartAttributes(smart)
                .sourceFileName(block.fileName())
                .sourceFormat(block.format())
                .extractedAt(extractedAt(block))
                .rawExcerpt(block.excerpt())
                .sourceHash(block.sourceHash())
                .build();
        return new NormalizedOutcome.Normalized(record);
    }

    /**
     * Removes whitespace and upper-cases. Text and PDF dialects pad some serials with a repeated
     * 2 to 4 character group ({@code ...ECE4ECE4}); on serials of 12 or more characters that
     * suffix is trimmed. Returns null when no usable serial remains.
     */
    static String normalizeSerial(String raw, SourceFormat format) {
        if (raw == null) {
            return null;
        }
        String serial = WHITESPACE.matcher(raw).replaceAll("").toUpperCase(Locale.ROOT);
        if (serial.isEmpty() || PLACEHOLDER_SERIALS.contains(serial)) {
            return null;
        }
        if ((format == SourceFormat.TEXT || format == SourceFormat.PDF)
                && serial.length() >= REPEATED_SUFFIX_MIN_LENGTH) {
            Matcher suffix = REPEATED_SUFFIX.matcher(serial);
            if (suffix.find() && suffix.start() > 0) {
                serial = serial.substring(0, suffix.start());
            }
        }
        return serial;
    }

    static SmartAttribute smartAttribute(RawSmartRow row) {
        Long raw = rawValue(row);
        if (raw != null) {
            if (row.id() == ATTR_TEMPERATURE || row.id() == ATTR_AIRFLOW_TEMPERATURE) {
                raw = raw & 0xFFL;
            } else if (row.id() == ATTR_POWER_ON_HOURS) {
                raw = raw & 0xFFFF_FFFFL;
            }
        }
        Integer value = integer(row.value());
        Integer threshold = integer(row.threshold());
        return new SmartAttribute(row.id(), row.name(), raw, value, integer(row.worst()), threshold,
                attributeStatus(row.status(), value, threshold));
    }

    private static Long rawValue(RawSmartRow row) {
        String raw = row.raw();
        if (raw == null) {
            return null;
        }
        String compact = WHITESPACE.matcher(raw).replaceAll("");
        boolean hex = row.hexRaw() || compact.startsWith("0x") || compact.startsWith("0X");
        if (hex) {
            Matcher m = HEX_DIGITS.matcher(compact);
            if (m.matches() && m.group(1).length() <= 16) {
                long value = Long.parseUnsignedLong(m.group(1), 16);
                return value < 0 ? null : value;
            }
            return null;
        }
        Matcher m = DECIMAL.matcher(raw);
        if (m.find() && m.group().length() <= 18) {
            return Long.parseLong(m.group());
        }
        return null;
    }

    private static HealthStatus attributeStatus(String status, Integer value, Integer threshold) {
        if (status != null && !status.isBlank()) {
            HealthStatus mapped = FieldValues.verdict(status);
            if (mapped.isKnown()) {
                return mapped;
            }
        }
        if (value != null && threshold != null && threshold > 0) {
            return value <= threshold ? HealthStatus.FAIL : HealthStatus.PASS;
        }
        return HealthStatus.UNKNOWN;
    }

    private static Integer integer(String value) {
        if (value == null) {
            return null;
        }
        Matcher m = DECIMAL.matcher(value);
        if (m.find() && m.group().length() <= 9) {
            return Integer.parseInt(m.group());
        }
        return null;
    }

    private static Optional<Long> smartRaw(SortedMap<Integer, SmartAttribute> smart, int id) {
        SmartAttribute attribute = smart.get(id);
        return attribute == null ? Optional.empty() : Optional.ofNullable(attribute.rawValue());
    }

    private Instant extractedAt(RawDriveBlock block) {
        return block.field(ReportField.REPORT_DATE)
                .flatMap(timestamps::parse)
                .or(block::dialectTimestamp)
                .or(block::sourceModified)
                .orElse(Instant.EPOCH);
    }

    private static String singleLine(String value) {
        return WHITESPACE.matcher(value).replaceAll(" ").strip();
    }

    private static NormalizedOutcome rejected(RawDriveBlock block, String detail) {
        return new NormalizedOutcome.Rejected(ParseError.at(block.fileName(), block.format(),
                ParseErrorReason.MISSING_REQUIRED_FIELD, detail, block.location()));
    }
}
