package com.libragraph.drivereport.core.job;

import com.libragraph.drivereport.formats.api.ResourceExhaustedException;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.concurrent.TimeoutException;

/**
 * @param reason    {@code RESOURCE_EXHAUSTED} for batch limit violations, otherwise the exception's simple name
 * @param retryable whether running the same job again could succeed
 */
public record JobError(
        String message,
        String exceptionType,
        String reason,
        String stackTrace,
        boolean retryable
) {
    public static JobError from(Throwable t) {
        var sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));

        boolean exhausted = t instanceof ResourceExhaustedException;
        boolean retryable = !exhausted
                && (t instanceof IOException || t instanceof TimeoutException);

        return new JobError(
                t.getMessage(),
                t.getClass().getName(),
                exhausted ? ResourceExhaustedException.REASON : t.getClass().getSimpleName(),
                sw.toString(),
                retryable
        );
    }
}
