package com.eyelevel.bulkconverter.service.ledger;

import java.time.Duration;
import java.util.Map;

/**
 * Aggregate view over the whole ledger.
 *
 * @param totalFailures  Number of rows.
 * @param uniqueFiles    Number of distinct identifiers.
 * @param byErrorKind    Row count per error type, in type order.
 * @param recentFailures Rows younger than {@code recentWindow}.
 */
public record FailureSummary(int totalFailures,
                             int uniqueFiles,
                             Map<String, Long> byErrorKind,
                             long recentFailures,
                             Duration recentWindow) {
}
