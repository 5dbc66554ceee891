package com.eyelevel.bulkconverter.model;

import java.time.Duration;

/**
 * Per-batch counters reported in the job status log.
 */
public record BatchSummary(int number,
                           int items,
                           int succeeded,
                           int skipped,
                           int failed,
                           int workers,
                           Duration elapsed) {
}
