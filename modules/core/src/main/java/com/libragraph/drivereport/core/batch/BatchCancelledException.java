package com.libragraph.drivereport.core.batch;

import com.libragraph.drivereport.formats.api.DriveReportException;

public class BatchCancelledException extends DriveReportException {

    public BatchCancelledException(String message) {
        super(message);
    }

    public BatchCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
