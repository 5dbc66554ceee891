package com.eyelevel.bulkconverter.model;

import java.time.LocalDateTime;

/**
 * One row of the failure ledger. Never mutated; a retried and still failing item appends a new record.
 */
public record FailureRecord(LocalDateTime timestamp,
                            String identifier,
                            long sizeBytes,
                            ErrorKind errorKind,
                            String message,
                            int attemptCount) {

    public static FailureRecord of(WorkItem item, ConversionOutcome outcome, LocalDateTime timestamp) {
        return new FailureRecord(timestamp, item.identifier(), item.sizeBytes(), outcome.getErrorKind(),
                                 outcome.getMessage(), Math.max(1, outcome.getAttempt()));
    }
}
