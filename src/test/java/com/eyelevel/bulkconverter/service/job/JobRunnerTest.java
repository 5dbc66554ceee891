package com.eyelevel.bulkconverter.service.job;

import com.eyelevel.bulkconverter.config.ConversionProperties;
import com.eyelevel.bulkconverter.converter.DocumentConverterFactory;
import com.eyelevel.bulkconverter.exception.JobAbortedException;
import com.eyelevel.bulkconverter.model.Batch;
import com.eyelevel.bulkconverter.model.BatchSummary;
import com.eyelevel.bulkconverter.model.ErrorKind;
import com.eyelevel.bulkconverter.model.FailureRecord;
import com.eyelevel.bulkconverter.model.ItemOutcome;
import com.eyelevel.bulkconverter.model.JobConfig;
import com.eyelevel.bulkconverter.model.JobResult;
import com.eyelevel.bulkconverter.model.JobStatus;
import com.eyelevel.bulkconverter.model.LocationDescriptor;
import com.eyelevel.bulkconverter.service.batch.BatchPlanner;
import com.eyelevel.bulkconverter.service.ledger.FailureLedger;
import com.eyelevel.bulkconverter.service.ledger.FailureQuery;
import com.eyelevel.bulkconverter.service.pipeline.ConcurrentPipeline;
import com.eyelevel.bulkconverter.support.InMemoryObjectStorage;
import com.eyelevel.bulkconverter.support.ScriptedConverter;
import com.eyelevel.bulkconverter.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class JobRunnerTest {

    private static final Instant NOW = Instant.parse("2026-10-19T08:30:15Z");

    @TempDir
    Path tempDir;

    private final LocationDescriptor main = new LocationDescriptor("https://store.example.com", "main", List.of(), "");
    private final LocationDescriptor source = new LocationDescriptor("https://src.example.com", "src", List.of("in"), "");
    private final LocationDescriptor dest = new LocationDescriptor("https://dst.example.com", "dst", List.of(), "");

    private InMemoryObjectStorage storage;
    private FailureLedger ledger;

    @BeforeEach
    void setUp() {
        storage = new InMemoryObjectStorage();
        ledger = new FailureLedger(tempDir.resolve("failed_conversions.csv"), Duration.ofHours(24),
                                   Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void tenItemsInBatchesOfFourWithTwoFailures() {
        seed(source, 10);
        storage.failDownloadOf("doc3.docx");
        JobRunner runner = runner(TestProperties.processing(true, 10, 4, true, 4), Set.of("doc9.docx"));

        JobResult result = runner.run(new JobConfig(main, source, dest));

        assertThat(result.getJobId()).isEqualTo("job_20261019_083015");
        assertThat(result.getTotalItems()).isEqualTo(10);
        assertThat(result.getSucceeded()).isEqualTo(8);
        assertThat(result.getFailed()).isEqualTo(2);
        assertThat(result.getStatus()).isEqualTo(JobStatus.PARTIAL_SUCCESS);
        assertThat(result.getBatchSummaries()).extracting(BatchSummary::items).containsExactly(4, 4, 2);
        assertThat(result.getBatchSummaries()).extracting(BatchSummary::workers).containsExactly(4, 4, 1);
        assertThat(result.getFailures()).extracting(FailureRecord::errorKind)
                                        .containsExactly(ErrorKind.DOWNLOAD_FAILED, ErrorKind.CONVERSION_FAILED);

        assertThat(storage.names(dest, "converted")).hasSize(8).doesNotContain("doc3.pdf", "doc9.pdf");
        assertThat(ledger.query(FailureQuery.all())).extracting(FailureRecord::identifier)
                                                    .containsExactly("doc3.docx", "doc9.docx");
        assertThat(storage.names(main, "job_status")).containsExactly("job_20261019_083015.log");
    }

    @Test
    void copiedAndUnsupportedFilesAreCountedSeparately() {
        storage.put(source, "files", "a.docx", new byte[]{1});
        storage.put(source, "files", "b.pdf", new byte[]{2});
        storage.put(source, "files", "c.tif", new byte[]{3});
        storage.put(source, "files", "d.zip", new byte[]{4});
        JobRunner runner = runner(TestProperties.defaults(), Set.of());

        JobResult result = runner.run(new JobConfig(main, source, dest));

        assertThat(result.getTotalItems()).isEqualTo(3);
        assertThat(result.getSucceeded()).isEqualTo(1);
        assertThat(result.getSkippedCopied()).isEqualTo(2);
        assertThat(result.getIgnoredUnsupported()).isEqualTo(1);
        assertThat(result.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(storage.names(dest, "converted")).containsExactly("a.pdf", "b.pdf", "c.tif");
    }

    @Test
    void repeatedFailureIncrementsTheAttemptCount() {
        storage.put(source, "files", "broken.docx", new byte[]{1});
        JobRunner runner = runner(TestProperties.defaults(), Set.of("broken.docx"));
        JobConfig config = new JobConfig(main, source, dest);

        runner.run(config);
        JobResult second = runner.run(config);

        assertThat(second.getFailures()).singleElement().extracting(FailureRecord::attemptCount).isEqualTo(2);
        assertThat(ledger.query(FailureQuery.all())).extracting(FailureRecord::attemptCount).containsExactly(1, 2);
        assertThat(second.getStatus()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void emptySourceStillUploadsAStatusLog() {
        JobResult result = runner(TestProperties.defaults(), Set.of()).run(JobConfig.staticConfig(main));

        assertThat(result.getStatus()).isEqualTo(JobStatus.NO_WORK);
        assertThat(result.getBatchSummaries()).isEmpty();
        assertThat(storage.names(main, "job_status")).hasSize(1);
    }

    @Test
    void unlistableSourceAbortsTheJobBeforeAnyItem() {
        seed(source, 3);
        storage.failListingOf("files");

        JobResult result = runner(TestProperties.defaults(), Set.of()).run(new JobConfig(main, source, dest));

        assertThat(result.isAborted()).isTrue();
        assertThat(result.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(result.getFatalError()).contains("Unable to list source folder");
        assertThat(storage.names(dest, "converted")).isEmpty();
        String log = new String(storage.get(main, "job_status", "job_20261019_083015.log"), StandardCharsets.UTF_8);
        assertThat(log).contains("Fatal error:", "FAILED");
    }

    @Test
    void fatalRunOnlyWritesTheStatusLog() {
        JobResult result = runner(TestProperties.defaults(), Set.of()).runFatal(main, "Trigger key 'dest_sas_url' is malformed");

        assertThat(result.isAborted()).isTrue();
        assertThat(result.getJobConfig()).isNull();
        String log = new String(storage.get(main, "job_status", "job_20261019_083015.log"), StandardCharsets.UTF_8);
        assertThat(log).contains("dest_sas_url");
        assertThat(ledger.query(FailureQuery.all())).isEmpty();
    }

    @Test
    void abortAfterTheFirstBatchKeepsItsResults() {
        seed(source, 4);
        ConversionProperties properties = TestProperties.processing(false, 10, 4, true, 2);
        BatchPlanner planner = new BatchPlanner(properties) {
            @Override
            public void pace(Batch completed) {
                throw new JobAbortedException("Interrupted while pacing after " + completed.label(),
                                              new InterruptedException());
            }
        };
        ConcurrentPipeline pipeline = new ConcurrentPipeline(storage, () -> new ScriptedConverter(Set.of("doc2.docx")),
                                                             properties);
        JobRunner runner = new JobRunner(storage, planner, pipeline, ledger, new JobStatusReporter(storage, properties),
                                         properties);

        JobResult result = runner.run(new JobConfig(main, source, dest));

        assertThat(result.isAborted()).isTrue();
        assertThat(result.getTotalItems()).isEqualTo(4);
        assertThat(result.getSucceeded()).isEqualTo(1);
        assertThat(result.getFailed()).isEqualTo(1);
        assertThat(result.getBatchSummaries()).extracting(BatchSummary::number).containsExactly(1);
        assertThat(result.getFailures()).extracting(FailureRecord::identifier).containsExactly("doc2.docx");
        assertThat(storage.names(dest, "converted")).containsExactly("doc1.pdf");
        String log = new String(storage.get(main, "job_status", "job_20261019_083015.log"), StandardCharsets.UTF_8);
        assertThat(log).contains("Fatal error:", "Total items:          4", "Converted:            1", "#1: 2 items");
    }

    @Test
    void unexpectedErrorStillUploadsTheStatusLog() {
        seed(source, 2);
        ConversionProperties properties = TestProperties.defaults();
        ConcurrentPipeline pipeline = new ConcurrentPipeline(storage, ScriptedConverter::new, properties) {
            @Override
            public List<ItemOutcome> run(Batch batch, JobConfig jobConfig) {
                throw new IllegalStateException("pool rejected the batch");
            }
        };
        JobRunner runner = new JobRunner(storage, new BatchPlanner(properties), pipeline, ledger,
                                         new JobStatusReporter(storage, properties), properties);

        JobResult result = runner.run(new JobConfig(main, source, dest));

        assertThat(result.isAborted()).isTrue();
        assertThat(result.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(result.getTotalItems()).isEqualTo(2);
        assertThat(result.getFatalError()).contains("IllegalStateException", "pool rejected the batch");
        String log = new String(storage.get(main, "job_status", "job_20261019_083015.log"), StandardCharsets.UTF_8);
        assertThat(log).contains("pool rejected the batch");
    }

    @Test
    void converterThatCannotBeCreatedFailsItemsAndTheJobStillReports() {
        seed(source, 2);
        DocumentConverterFactory broken = () -> {
            throw new IllegalStateException("office manager not running");
        };

        JobResult result = runner(TestProperties.defaults(), broken).run(new JobConfig(main, source, dest));

        assertThat(result.isAborted()).isFalse();
        assertThat(result.getFailed()).isEqualTo(2);
        assertThat(result.getFailures()).extracting(FailureRecord::errorKind)
                                        .containsOnly(ErrorKind.PROCESSING_ERROR);
        assertThat(ledger.query(FailureQuery.all())).hasSize(2);
        assertThat(storage.names(main, "job_status")).containsExactly("job_20261019_083015.log");
    }

    @Test
    void malformedLedgerRowDoesNotStopFailureRecording() throws Exception {
        Files.writeString(ledger.getLedgerPath(),
                          "timestamp,filename,file_size_bytes,error_type,error_message,attempt_count\n"
                          + "2026-10-19T07:00,old.docx,1,CONVERSION_FAILED,legacy,1,EXTRA\n");
        storage.put(source, "files", "broken.docx", new byte[]{1});

        JobResult result = runner(TestProperties.defaults(), Set.of("broken.docx")).run(new JobConfig(main, source, dest));

        assertThat(result.getFailures()).singleElement().extracting(FailureRecord::attemptCount).isEqualTo(1);
        assertThat(ledger.query(FailureQuery.all())).extracting(FailureRecord::identifier)
                                                    .containsExactly("old.docx", "broken.docx");
    }

    private JobRunner runner(ConversionProperties properties, Set<String> rejected) {
        return runner(properties, () -> new ScriptedConverter(rejected));
    }

    private JobRunner runner(ConversionProperties properties, DocumentConverterFactory converterFactory) {
        BatchPlanner planner = new BatchPlanner(properties);
        ConcurrentPipeline pipeline = new ConcurrentPipeline(storage, converterFactory, properties);
        JobStatusReporter reporter = new JobStatusReporter(storage, properties);
        return new JobRunner(storage, planner, pipeline, ledger, reporter, properties);
    }

    private void seed(LocationDescriptor location, int count) {
        IntStream.rangeClosed(1, count)
                 .forEach(i -> storage.put(location, "files", "doc" + i + ".docx", new byte[]{(byte) i}));
    }
}
