package com.libragraph.drivereport.core.export;

import com.libragraph.drivereport.core.batch.BatchResult;
import com.libragraph.drivereport.core.reconcile.ReconciliationGroup;
import com.libragraph.drivereport.formats.model.CanonicalDriveRecord;
import com.libragraph.drivereport.formats.model.ParseError;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens a batch result into string rows for the spreadsheet export: one row per drive and
 * one row per parse error. Missing defect counters export as 0; a missing health score exports
 * as an empty cell.
 */
@ApplicationScoped
public class DriveSummaryRows {

    public static final List<String> DRIVE_HEADER = List.of(
            "Label Serial", "VPD Serial", "Model Number", "Vendor Information", "Vendor", "File Name",
            "Health Score", "Allocated Sections", "Grown Defects",
            "Interface", "Capacity Bytes", "Overall Health", "Temperature C", "Power On Hours");

    public static final List<String> ERROR_HEADER = List.of("File Name", "Reason", "Detail");

    private static final String FILE_NAME_SEPARATOR = "; ";

    public List<List<String>> driveRows(BatchResult result) {
        List<List<String>> rows = new ArrayList<>(result.groups().size());
        for (ReconciliationGroup group : result.groups()) {
            rows.add(driveRow(group));
        }
        return rows;
    }

    public List<String> driveRow(ReconciliationGroup group) {
        CanonicalDriveRecord record = group.merged().record();
        return List.of(
                record.labelSerial(),
                record.serialNumber(),
                record.model(),
                record.vendorInformation(),
                record.vendor().displayName(),
                String.join(FILE_NAME_SEPARATOR, group.sourceFileNames()),
                text(record.healthScore()),
                String.valueOf(orZero(record.reallocatedSectors())),
                String.valueOf(orZero(record.grownDefects())),
                record.interfaceType().name(),
                String.valueOf(record.capacityBytes()),
                record.overallHealth().name(),
                text(record.temperatureCelsius()),
                text(record.powerOnHours()));
    }

    public List<List<String>> errorRows(BatchResult result) {
        List<List<String>> rows = new ArrayList<>(result.errors().size());
        for (ParseError error : result.errors()) {
            String detail = error.offsetHint() == null
                    ? error.detail()
                    : error.detail() + " (" + error.offsetHint() + ")";
            rows.add(List.of(error.fileName(), error.reason().label(), detail));
        }
        return rows;
    }

    private static String text(Object value) {
        return value == null ? "" : value.toString();
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }
}
