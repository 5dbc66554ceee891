package com.eyelevel.bulkconverter.service.pipeline;

import com.eyelevel.bulkconverter.config.ConversionProperties;
import com.eyelevel.bulkconverter.converter.DocumentConverterFactory;
import com.eyelevel.bulkconverter.model.Batch;
import com.eyelevel.bulkconverter.model.ConversionOutcome;
import com.eyelevel.bulkconverter.model.ErrorKind;
import com.eyelevel.bulkconverter.model.ItemOutcome;
import com.eyelevel.bulkconverter.model.JobConfig;
import com.eyelevel.bulkconverter.model.WorkItem;
import com.eyelevel.bulkconverter.storage.ObjectStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs the conversion workers over one batch.
 * <p>
 * A batch of at least {@code min-items-for-concurrency} items is processed by a pool of
 * {@code min(maxWorkers, batchSize)} threads that pull item indexes from a shared counter and write outcomes
 * into a slot per index; smaller batches are processed sequentially with the same per-item logic. Either way
 * the result has exactly one outcome per item, in batch order.
 */
@Slf4j
@Service
public class ConcurrentPipeline {

    private final ObjectStorage storage;
    private final DocumentConverterFactory converterFactory;
    private final ConversionProperties.Processing settings;
    private final ConversionProperties.Folders folders;

    public ConcurrentPipeline(final ObjectStorage storage, final DocumentConverterFactory converterFactory,
                              final ConversionProperties properties) {
        this.storage = storage;
        this.converterFactory = converterFactory;
        this.settings = properties.processing();
        this.folders = properties.folders();
    }

    /**
     * Processes every item of {@code batch}.
     *
     * @return One {@link ItemOutcome} per batch item, in the batch's order.
     */
    public List<ItemOutcome> run(final Batch batch, final JobConfig jobConfig) {
        if (batch.size() == 0) {
            return List.of();
        }
        if (isConcurrent(batch)) {
            return runConcurrently(batch, jobConfig);
        }
        return runSequentially(batch, jobConfig);
    }

    public boolean isConcurrent(final Batch batch) {
        return settings.enableConcurrency() && batch.size() >= settings.minItemsForConcurrency();
    }

    /**
     * @return The number of worker threads {@link #run} uses for {@code batch}.
     */
    public int workerCount(final Batch batch) {
        return isConcurrent(batch) ? Math.min(settings.maxWorkers(), Math.max(1, batch.size())) : 1;
    }

    private List<ItemOutcome> runSequentially(final Batch batch, final JobConfig jobConfig) {
        log.info("[{}] Processing {} documents sequentially (threshold for concurrency: {}).", batch.label(),
                 batch.size(), settings.minItemsForConcurrency());
        final List<ItemOutcome> outcomes = new ArrayList<>(batch.size());
        final ConversionWorker worker;
        try {
            worker = newWorker(jobConfig);
        } catch (RuntimeException e) {
            log.error("[{}] Could not create a conversion worker.", batch.label(), e);
            batch.items().forEach(item -> outcomes.add(new ItemOutcome(item, notProcessed(item))));
            return outcomes;
        }
        for (WorkItem item : batch.items()) {
            outcomes.add(new ItemOutcome(item, worker.process(item)));
        }
        return outcomes;
    }

    private List<ItemOutcome> runConcurrently(final Batch batch, final JobConfig jobConfig) {
        final List<WorkItem> items = batch.items();
        final int poolSize = workerCount(batch);
        log.info("[{}] Starting concurrent processing with {} workers for {} documents.", batch.label(), poolSize,
                 items.size());

        final AtomicInteger nextIndex = new AtomicInteger();
        final AtomicReferenceArray<ConversionOutcome> slots = new AtomicReferenceArray<>(items.size());
        final ExecutorService executor = Executors.newFixedThreadPool(poolSize,
                                                                      new CustomizableThreadFactory("convert-worker-"));
        final List<Future<?>> futures = new ArrayList<>(poolSize);
        try {
            for (int i = 0; i < poolSize; i++) {
                futures.add(executor.submit(() -> drain(items, nextIndex, slots, newWorker(jobConfig))));
            }
            for (Future<?> future : futures) {
                awaitWorker(future, batch);
            }
        } finally {
            shutdown(executor, batch);
        }

        final List<ItemOutcome> outcomes = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            ConversionOutcome outcome = slots.get(i);
            if (outcome == null) {
                outcome = notProcessed(items.get(i));
            }
            outcomes.add(new ItemOutcome(items.get(i), outcome));
        }
        return outcomes;
    }

    private static void drain(final List<WorkItem> items, final AtomicInteger nextIndex,
                              final AtomicReferenceArray<ConversionOutcome> slots, final ConversionWorker worker) {
        int index;
        while ((index = nextIndex.getAndIncrement()) < items.size()) {
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            slots.set(index, worker.process(items.get(index)));
        }
    }

    private static void awaitWorker(final Future<?> future, final Batch batch) {
        try {
            future.get();
        } catch (ExecutionException e) {
            log.error("[{}] A conversion worker terminated unexpectedly.", batch.label(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted while waiting for conversion workers.", batch.label());
        }
    }

    private static void shutdown(final ExecutorService executor, final Batch batch) {
        if (Thread.currentThread().isInterrupted()) {
            executor.shutdownNow();
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("[{}] Conversion workers did not stop in time; forcing shutdown.", batch.label());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static ConversionOutcome notProcessed(final WorkItem item) {
        return ConversionOutcome.failed(ErrorKind.PROCESSING_ERROR,
                                        "Worker stopped before processing " + item.identifier(), 1);
    }

    private ConversionWorker newWorker(final JobConfig jobConfig) {
        return new ConversionWorker(storage, converterFactory.create(), jobConfig, folders);
    }
}
