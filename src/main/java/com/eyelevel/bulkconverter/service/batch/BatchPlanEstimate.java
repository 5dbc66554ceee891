package com.eyelevel.bulkconverter.service.batch;

import java.time.Duration;

/**
 * What a batch plan for a given work-set size will look like before it runs.
 *
 * @param totalItems   The size of the work set.
 * @param batchCount   The number of batches the planner will produce.
 * @param batchSize    The effective batch size.
 * @param totalPacing  The accumulated inter-batch delay.
 */
public record BatchPlanEstimate(int totalItems, int batchCount, int batchSize, Duration totalPacing) {
}
