package com.libragraph.drivereport.core.reconcile;

import com.libragraph.drivereport.formats.model.CanonicalDriveRecord;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Groups canonical records by serial number and merges each group field by field.
 *
 * <p>The serial number is the only grouping key. Two physically distinct drives reporting the
 * same serial end up in one group; their differences surface as {@link FieldConflict}s.
 *
 * <p>Members are ranked by completeness, then newest {@code extractedAt}, then format
 * precedence (PDF, HTML, TEXT), then source file name, source hash, model and excerpt. Every
 * merged field comes from the highest-ranked member that populates it. The result depends only
 * on the set of input records, never on their order. The health score always comes from the
 * member that supplied the health verdict, so the merged pair stays consistent.
 */
@ApplicationScoped
public class DuplicateReconciler {

    private static final Logger log = Logger.getLogger(DuplicateReconciler.class);

    static final Comparator<CanonicalDriveRecord> MERGE_RANK =
            Comparator.comparingInt(CanonicalDriveRecord::completeness).reversed()
                    .thenComparing(CanonicalDriveRecord::extractedAt, Comparator.reverseOrder())
                    .thenComparing(r -> r.sourceFormat().mergePrecedence(), Comparator.reverseOrder())
                    .thenComparing(CanonicalDriveRecord::sourceFileName)
                    .thenComparing(CanonicalDriveRecord::sourceHash, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparing(CanonicalDriveRecord::model)
                    .thenComparing(CanonicalDriveRecord::rawExcerpt)
                    .thenComparing(CanonicalDriveRecord::toString);

    /**
     * @return one group per distinct serial, sorted by serial
     */
    public List<ReconciliationGroup> reconcile(Collection<CanonicalDriveRecord> records) {
        Map<String, List<CanonicalDriveRecord>> bySerial = new TreeMap<>();
        for (CanonicalDriveRecord record : records) {
            bySerial.computeIfAbsent(groupKey(record.serialNumber()), k -> new ArrayList<>()).add(record);
        }

        List<ReconciliationGroup> groups = new ArrayList<>(bySerial.size());
        bySerial.values().forEach(members -> groups.add(merge(members)));

        long conflicts = groups.stream().mapToLong(g -> g.conflicts().size()).sum();
        log.debugf("Reconciled %d records into %d drives (%d field conflicts)",
                records.size(), groups.size(), conflicts);
        return groups;
    }

    static String groupKey(String serial) {
        return serial.strip().toUpperCase(Locale.ROOT);
    }

    private static ReconciliationGroup merge(List<CanonicalDriveRecord> members) {
        List<CanonicalDriveRecord> ranked = new ArrayList<>(members);
        ranked.sort(MERGE_RANK);
        CanonicalDriveRecord primary = ranked.get(0);
        RecordSource primarySource = RecordSource.of(primary);
        String serial = primary.serialNumber().strip();

        CanonicalDriveRecord.Builder builder = CanonicalDriveRecord.builder(serial)
                .sourceFileName(primary.sourceFileName())
                .sourceFormat(primary.sourceFormat())
                .extractedAt(primary.extractedAt())
                .rawExcerpt(primary.rawExcerpt())
                .sourceHash(primary.sourceHash());

        List<FieldResolution> resolutions = new ArrayList<>();
        List<FieldConflict> conflicts = new ArrayList<>();
        Map<DriveField, CanonicalDriveRecord> chosen = new EnumMap<>(DriveField.class);
        for (DriveField field : DriveField.values()) {
            CanonicalDriveRecord source = field.resolvedWith()
                    .map(chosen::get)
                    .orElseGet(() -> ranked.stream().filter(field::isPopulated).findFirst().orElse(null));
            boolean populated = source != null && field.isPopulated(source);
            CanonicalDriveRecord from = source == null ? primary : source;
            field.copy(from, builder);
            if (populated) {
                chosen.put(field, from);
            }
            resolutions.add(new FieldResolution(field, RecordSource.of(from), populated));
            conflict(field, populated ? field.render(from) : null, ranked).ifPresent(conflicts::add);
        }

        return new ReconciliationGroup(serial, ranked,
                new MergedRecord(builder.build(), primarySource, resolutions), conflicts);
    }

    private static Optional<FieldConflict> conflict(DriveField field, String chosen,
                                                    List<CanonicalDriveRecord> ranked) {
        Set<Object> distinct = new LinkedHashSet<>();
        List<FieldConflict.SourcedValue> values = new ArrayList<>();
        for (CanonicalDriveRecord member : ranked) {
            if (!field.isPopulated(member)) {
                continue;
            }
            distinct.add(field.value(member));
            values.add(new FieldConflict.SourcedValue(RecordSource.of(member), field.render(member)));
        }
        if (distinct.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(new FieldConflict(field, chosen, values));
    }
}
