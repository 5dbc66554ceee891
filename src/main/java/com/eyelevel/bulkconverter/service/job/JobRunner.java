package com.eyelevel.bulkconverter.service.job;

import com.eyelevel.bulkconverter.config.ConversionProperties;
import com.eyelevel.bulkconverter.exception.BulkConversionException;
import com.eyelevel.bulkconverter.exception.JobAbortedException;
import com.eyelevel.bulkconverter.exception.StorageException;
import com.eyelevel.bulkconverter.model.Batch;
import com.eyelevel.bulkconverter.model.BatchSummary;
import com.eyelevel.bulkconverter.model.ConversionOutcome;
import com.eyelevel.bulkconverter.model.FailureRecord;
import com.eyelevel.bulkconverter.model.FormatHint;
import com.eyelevel.bulkconverter.model.ItemOutcome;
import com.eyelevel.bulkconverter.model.JobConfig;
import com.eyelevel.bulkconverter.model.JobResult;
import com.eyelevel.bulkconverter.model.LocationDescriptor;
import com.eyelevel.bulkconverter.model.StoredObject;
import com.eyelevel.bulkconverter.model.WorkItem;
import com.eyelevel.bulkconverter.service.batch.BatchPlanEstimate;
import com.eyelevel.bulkconverter.service.batch.BatchPlanner;
import com.eyelevel.bulkconverter.service.ledger.FailureLedger;
import com.eyelevel.bulkconverter.service.pipeline.ConcurrentPipeline;
import com.eyelevel.bulkconverter.storage.ObjectStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Executes one job end to end: discovers the work items in the source work folder, runs them batch by batch
 * through the {@link ConcurrentPipeline}, records failures in the {@link FailureLedger} and uploads the
 * status log.
 * <p>
 * Batches are strictly sequential. The next batch starts only after every outcome of the previous one has
 * been collected and the pacing delay has elapsed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobRunner {

    private static final DateTimeFormatter JOB_ID_FORMAT = DateTimeFormatter.ofPattern("'job_'yyyyMMdd_HHmmss");

    private final ObjectStorage storage;
    private final BatchPlanner batchPlanner;
    private final ConcurrentPipeline pipeline;
    private final FailureLedger failureLedger;
    private final JobStatusReporter statusReporter;
    private final ConversionProperties properties;

    /**
     * Runs the job described by {@code jobConfig}. Never throws: per-item problems become failures, and a job
     * that cannot start or stops midway (e.g. its source folder cannot be listed) is returned as an aborted
     * result that keeps the counts of the batches already processed. The status log is uploaded either way.
     */
    public JobResult run(final JobConfig jobConfig) {
        final LocalDateTime startedAt = failureLedger.now();
        final String jobId = jobId(startedAt);
        final long startNanos = System.nanoTime();
        log.info("[{}] Starting bulk conversion. Source: {}, Destination: {}", jobId,
                 jobConfig.sourceLocation().describe(), jobConfig.destLocation().describe());

        final JobResult.JobResultBuilder builder = JobResult.builder()
                                                            .jobId(jobId)
                                                            .startedAt(startedAt)
                                                            .jobConfig(jobConfig);
        try {
            execute(jobId, jobConfig, builder);
        } catch (JobAbortedException e) {
            log.error("[{}] Job aborted: {}", jobId, e.getMessage(), e);
            builder.fatalError(e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] Job stopped by an unexpected error.", jobId, e);
            builder.fatalError("Unexpected error: " + e);
        }
        final JobResult result = builder.elapsedDuration(Duration.ofNanos(System.nanoTime() - startNanos)).build();

        logSummary(result);
        reportStatus(jobConfig.mainLocation(), result);
        return result;
    }

    /**
     * Records a job that failed before a {@link JobConfig} could be built, e.g. because the trigger carried a
     * malformed location. No item is attempted; only the status log is written.
     */
    public JobResult runFatal(final LocationDescriptor mainLocation, final String reason) {
        final LocalDateTime startedAt = failureLedger.now();
        final JobResult result = JobResult.builder()
                                          .jobId(jobId(startedAt))
                                          .startedAt(startedAt)
                                          .elapsedDuration(Duration.ZERO)
                                          .fatalError(reason)
                                          .build();
        log.error("[{}] Job failed before processing any item: {}", result.getJobId(), reason);
        reportStatus(mainLocation, result);
        return result;
    }

    static String jobId(final LocalDateTime startedAt) {
        return JOB_ID_FORMAT.format(startedAt);
    }

    /**
     * Fills {@code result} as the job progresses, so whatever has been recorded survives an abort.
     */
    private void execute(final String jobId, final JobConfig jobConfig, final JobResult.JobResultBuilder result) {
        final List<WorkItem> discovered = discover(jobId, jobConfig.sourceLocation());
        final List<WorkItem> items = new ArrayList<>(discovered.size());
        int ignored = 0;
        for (WorkItem item : discovered) {
            if (item.formatHint() == FormatHint.UNSUPPORTED) {
                log.warn("[{}] Ignoring '{}': unsupported file type.", jobId, item.identifier());
                ignored++;
            } else {
                items.add(item);
            }
        }

        result.totalItems(items.size()).ignoredUnsupported(ignored);
        if (items.isEmpty()) {
            log.info("[{}] No convertible files found in the source folder.", jobId);
            return;
        }

        final BatchPlanEstimate estimate = batchPlanner.estimate(items.size());
        log.info("[{}] Found {} files to process in {} batch(es) of up to {} (pacing adds {}).", jobId,
                 items.size(), estimate.batchCount(), estimate.batchSize(), estimate.totalPacing());

        int succeeded = 0;
        int copied = 0;
        int failed = 0;
        long bytes = 0;
        for (Batch batch : batchPlanner.plan(items)) {
            final long batchStart = System.nanoTime();
            final List<ItemOutcome> outcomes = pipeline.run(batch, jobConfig);

            int batchSucceeded = 0;
            int batchSkipped = 0;
            final List<ItemOutcome> batchFailures = new ArrayList<>();
            for (ItemOutcome itemOutcome : outcomes) {
                final ConversionOutcome outcome = itemOutcome.outcome();
                if (outcome.isSuccess()) {
                    batchSucceeded++;
                    bytes += outcome.getOutputBytes();
                } else if (outcome.isSkipped()) {
                    batchSkipped++;
                } else {
                    batchFailures.add(itemOutcome);
                }
            }
            final List<FailureRecord> records = recordFailures(jobId, batchFailures);
            final Duration elapsed = Duration.ofNanos(System.nanoTime() - batchStart);

            succeeded += batchSucceeded;
            copied += batchSkipped;
            failed += records.size();
            result.succeeded(succeeded)
                  .skippedCopied(copied)
                  .failed(failed)
                  .totalBytesProcessed(bytes)
                  .failures(records);
            result.batchSummary(new BatchSummary(batch.number(), batch.size(), batchSucceeded, batchSkipped,
                                                 records.size(), pipeline.workerCount(batch), elapsed));
            log.info("[{}] [{}] Completed in {} ms: {} converted, {} copied, {} failed.", jobId, batch.label(),
                     elapsed.toMillis(), batchSucceeded, batchSkipped, records.size());

            batchPlanner.pace(batch);
        }
    }

    private List<WorkItem> discover(final String jobId, final LocationDescriptor source) {
        final String workFolder = properties.folders().work();
        final List<StoredObject> objects;
        try {
            objects = storage.list(source, workFolder);
        } catch (StorageException e) {
            throw new JobAbortedException("Unable to list source folder " + source.folderPath(workFolder) + ": "
                                          + e.getMessage(), e);
        }
        log.debug("[{}] Listed {} object(s) in {}.", jobId, objects.size(), source.folderPath(workFolder));
        return objects.stream().map(object -> WorkItem.of(object.name(), object.sizeBytes())).toList();
    }

    /**
     * Appends the batch's failures to the ledger, numbering each attempt after the rows already recorded for
     * the same file. If the previous rows cannot be counted the failures are still appended as first attempts;
     * a ledger write error is logged and the failures still reach the status log.
     */
    private List<FailureRecord> recordFailures(final String jobId, final List<ItemOutcome> failures) {
        if (failures.isEmpty()) {
            return List.of();
        }
        final LocalDateTime now = failureLedger.now();
        Map<String, Integer> previous;
        try {
            previous = failureLedger.attemptCounts(failures.stream().map(failure -> failure.item().identifier())
                                                           .toList());
        } catch (BulkConversionException e) {
            log.warn("[{}] Could not count earlier attempts; recording failures as first attempts.", jobId, e);
            previous = Map.of();
        }

        final List<FailureRecord> records = new ArrayList<>(failures.size());
        for (ItemOutcome failure : failures) {
            final FailureRecord record = FailureRecord.of(failure.item(), failure.outcome(), now);
            final int attempt = previous.getOrDefault(record.identifier(), 0) + 1;
            records.add(new FailureRecord(record.timestamp(), record.identifier(), record.sizeBytes(),
                                          record.errorKind(), record.message(), attempt));
        }
        try {
            failureLedger.appendAll(records);
        } catch (BulkConversionException e) {
            log.error("[{}] Failed to record {} failure(s) in the ledger.", jobId, records.size(), e);
        }
        return records;
    }

    private void reportStatus(final LocationDescriptor mainLocation, final JobResult result) {
        try {
            statusReporter.upload(mainLocation, result);
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error while uploading the status log.", result.getJobId(), e);
        }
    }

    private static void logSummary(final JobResult result) {
        log.info("[{}] ------------------------------------------------------------------", result.getJobId());
        log.info("[{}] Job finished with status {} in {}.", result.getJobId(), result.getStatus(),
                 result.getElapsedDuration());
        log.info("[{}] Total: {}, converted: {}, copied: {}, failed: {}, ignored: {}.", result.getJobId(),
                 result.getTotalItems(), result.getSucceeded(), result.getSkippedCopied(), result.getFailed(),
                 result.getIgnoredUnsupported());
        log.info("[{}] ------------------------------------------------------------------", result.getJobId());
    }
}
