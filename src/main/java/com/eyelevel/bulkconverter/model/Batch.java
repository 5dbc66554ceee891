package com.eyelevel.bulkconverter.model;

import java.util.List;

/**
 * A fixed-size chunk of the work set, processed as one concurrency-bounded unit.
 *
 * @param number       The 1-based position of this batch.
 * @param totalBatches The number of batches in the plan this batch belongs to.
 * @param items        The work items of this batch, in discovery order.
 */
public record Batch(int number, int totalBatches, List<WorkItem> items) {

    public Batch {
        items = List.copyOf(items);
    }

    public int size() {
        return items.size();
    }

    public boolean isLast() {
        return number == totalBatches;
    }

    public String label() {
        return "Batch " + number + "/" + totalBatches;
    }
}
