package com.eyelevel.bulkconverter.service.batch;

import com.eyelevel.bulkconverter.config.ConversionProperties;
import com.eyelevel.bulkconverter.exception.JobAbortedException;
import com.eyelevel.bulkconverter.model.Batch;
import com.eyelevel.bulkconverter.model.WorkItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Partitions a discovered work set into fixed-size batches and paces their execution.
 * <p>
 * Partitioning is pure: {@link #plan(List, int)} returns a lazy view that can be iterated any number of times
 * without side effects. Pacing bounds peak memory and connection usage across large work sets; it adds no
 * correctness.
 */
@Slf4j
@Component
public class BatchPlanner {

    private final ConversionProperties.Processing settings;

    public BatchPlanner(ConversionProperties properties) {
        this.settings = properties.processing();
    }

    /**
     * Plans the batches of a job using the configured batch size. When batching is disabled the whole work set
     * forms a single batch.
     */
    public Iterable<Batch> plan(final List<WorkItem> items) {
        return plan(items, effectiveBatchSize(items.size()));
    }

    /**
     * Partitions {@code items} into {@code ceil(n / batchSize)} batches, each of {@code batchSize} items except
     * possibly the last. Item order is preserved.
     *
     * @throws IllegalArgumentException if {@code batchSize} is not positive.
     */
    public Iterable<Batch> plan(final List<WorkItem> items, final int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, got " + batchSize);
        }
        final List<WorkItem> snapshot = List.copyOf(items);
        final int totalBatches = batchCount(snapshot.size(), batchSize);
        return () -> new BatchIterator(snapshot, batchSize, totalBatches);
    }

    public BatchPlanEstimate estimate(final int totalItems) {
        final int batchSize = effectiveBatchSize(totalItems);
        final int batches = batchCount(totalItems, batchSize);
        final Duration pacing = settings.batchDelay().multipliedBy(Math.max(0, batches - 1));
        return new BatchPlanEstimate(totalItems, batches, batchSize, pacing);
    }

    /**
     * Waits the configured inter-batch delay after {@code completed}, unless it was the last batch, and marks
     * the point where the finished batch's workers and buffers are no longer referenced.
     *
     * @throws JobAbortedException if the thread is interrupted while waiting (process shutdown).
     */
    public void pace(final Batch completed) {
        if (completed.isLast()) {
            return;
        }
        final Duration delay = settings.batchDelay();
        if (!delay.isZero() && !delay.isNegative()) {
            log.info("[{}] Waiting {} ms before the next batch...", completed.label(), delay.toMillis());
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new JobAbortedException("Interrupted while pacing after " + completed.label(), e);
            }
        }
        log.debug("[{}] Resources released, ready for the next batch.", completed.label());
    }

    private int effectiveBatchSize(final int totalItems) {
        return settings.enableBatching() ? settings.batchSize() : Math.max(1, totalItems);
    }

    private static int batchCount(final int totalItems, final int batchSize) {
        return (totalItems + batchSize - 1) / batchSize;
    }

    private static final class BatchIterator implements Iterator<Batch> {

        private final List<WorkItem> items;
        private final int batchSize;
        private final int totalBatches;
        private int nextBatch;

        private BatchIterator(List<WorkItem> items, int batchSize, int totalBatches) {
            this.items = items;
            this.batchSize = batchSize;
            this.totalBatches = totalBatches;
        }

        @Override
        public boolean hasNext() {
            return nextBatch < totalBatches;
        }

        @Override
        public Batch next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            final int start = nextBatch * batchSize;
            final int end = Math.min(start + batchSize, items.size());
            nextBatch++;
            return new Batch(nextBatch, totalBatches, items.subList(start, end));
        }
    }
}
