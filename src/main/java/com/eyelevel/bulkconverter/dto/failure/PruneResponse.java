package com.eyelevel.bulkconverter.dto.failure;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of removing old rows from the failure ledger.
 */
@Getter
@AllArgsConstructor
public class PruneResponse {
    private final int removedRecords;
    private final int olderThanDays;
}
