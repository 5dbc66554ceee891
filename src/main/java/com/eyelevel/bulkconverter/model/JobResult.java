package com.eyelevel.bulkconverter.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Aggregate outcome of one job, produced at job end and consumed by the status-log upload.
 */
@Getter
@Builder
public class JobResult {

    private final String jobId;
    private final LocalDateTime startedAt;
    private final JobConfig jobConfig;
    private final int totalItems;
    private final int succeeded;
    private final int skippedCopied;
    private final int failed;
    private final int ignoredUnsupported;
    private final long totalBytesProcessed;
    private final Duration elapsedDuration;
    @Singular
    private final List<BatchSummary> batchSummaries;
    @Singular
    private final List<FailureRecord> failures;

    /**
     * Set only when the job aborted before or while processing items.
     */
    private final String fatalError;

    public boolean isAborted() {
        return fatalError != null;
    }

    public JobStatus getStatus() {
        if (isAborted()) {
            return JobStatus.FAILED;
        }
        if (totalItems == 0) {
            return JobStatus.NO_WORK;
        }
        if (failed == 0) {
            return JobStatus.COMPLETED;
        }
        return succeeded + skippedCopied > 0 ? JobStatus.PARTIAL_SUCCESS : JobStatus.FAILED;
    }
}
