package com.eyelevel.bulkconverter.service.job;

import com.eyelevel.bulkconverter.config.ConversionProperties;
import com.eyelevel.bulkconverter.exception.StorageException;
import com.eyelevel.bulkconverter.exception.TransientStorageException;
import com.eyelevel.bulkconverter.model.BatchSummary;
import com.eyelevel.bulkconverter.model.FailureRecord;
import com.eyelevel.bulkconverter.model.JobConfig;
import com.eyelevel.bulkconverter.model.JobResult;
import com.eyelevel.bulkconverter.model.LocationDescriptor;
import com.eyelevel.bulkconverter.storage.ObjectStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

/**
 * Writes the human-readable run log of a job to the main location's status folder.
 * The log is uploaded after every job, including jobs that aborted before processing any item.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStatusReporter {

    static final String LOG_EXTENSION = ".log";

    private final ObjectStorage storage;
    private final ConversionProperties properties;

    /**
     * Uploads {@code job_<yyyyMMdd>_<HHmmss>.log} for {@code result}. Transient storage errors are retried;
     * a log that still cannot be uploaded is reported and dropped, it never fails the job.
     */
    @Retryable(retryFor = TransientStorageException.class,
               maxAttemptsExpression = "#{${app.status-log.retry-attempts:3} + 1}",
               backoff = @Backoff(delayExpression = "#{${app.status-log.retry-delay-ms:2000}}"),
               listeners = {"statusLogRetryListener"})
    public void upload(final LocationDescriptor mainLocation, final JobResult result) {
        final String logName = logName(result);
        final byte[] content = render(result).getBytes(StandardCharsets.UTF_8);
        storage.upload(mainLocation, properties.folders().status(), logName, content);
        log.info("[{}] Uploaded status log '{}' to {}/{}.", result.getJobId(), logName, mainLocation.describe(),
                 properties.folders().status());
    }

    @Recover
    public void recover(final StorageException e, final LocationDescriptor mainLocation, final JobResult result) {
        log.error("[{}] Status log '{}' could not be uploaded after all retry attempts.", result.getJobId(),
                  logName(result), e);
    }

    static String logName(final JobResult result) {
        return result.getJobId() + LOG_EXTENSION;
    }

    /**
     * Renders the plain-text report. Locations are written in their masked form.
     */
    static String render(final JobResult result) {
        final StringBuilder report = new StringBuilder();
        line(report, "Bulk conversion job %s", result.getJobId());
        line(report, "Started:              %s", result.getStartedAt());
        line(report, "Status:               %s", result.getStatus());

        final JobConfig jobConfig = result.getJobConfig();
        if (jobConfig != null) {
            line(report, "Configuration:        %s", jobConfig.isDynamic() ? "dynamic (from trigger)" : "static");
            line(report, "Source:               %s", jobConfig.sourceLocation().describe());
            line(report, "Destination:          %s", jobConfig.destLocation().describe());
        }
        if (result.isAborted()) {
            line(report, "Fatal error:          %s", result.getFatalError());
        }

        report.append('\n');
        line(report, "Total items:          %d", result.getTotalItems());
        line(report, "Converted:            %d", result.getSucceeded());
        line(report, "Copied as-is:         %d", result.getSkippedCopied());
        line(report, "Failed:               %d", result.getFailed());
        line(report, "Ignored (unsupported): %d", result.getIgnoredUnsupported());
        line(report, "Output produced:      %s", FileUtils.byteCountToDisplaySize(result.getTotalBytesProcessed()));
        line(report, "Elapsed:              %s", result.getElapsedDuration());

        if (!result.getBatchSummaries().isEmpty()) {
            report.append("\nBatches:\n");
            for (BatchSummary batch : result.getBatchSummaries()) {
                line(report, "  #%d: %d items, %d converted, %d copied, %d failed, %d worker(s), %s",
                     batch.number(), batch.items(), batch.succeeded(), batch.skipped(), batch.failed(),
                     batch.workers(), batch.elapsed());
            }
        }
        if (!result.getFailures().isEmpty()) {
            report.append("\nFailures:\n");
            for (FailureRecord failure : result.getFailures()) {
                line(report, "  %s [%s] attempt %d: %s", failure.identifier(), failure.errorKind(),
                     failure.attemptCount(), failure.message());
            }
        }
        return report.toString();
    }

    private static void line(final StringBuilder report, final String format, final Object... args) {
        report.append(String.format(format, args)).append('\n');
    }
}
