package com.eyelevel.bulkconverter.model;

/**
 * The terminal state of one attempt at a work item.
 */
public enum OutcomeStatus {
    /**
     * The item was converted and the PDF uploaded.
     */
    SUCCESS,
    /**
     * Conversion was not needed (verbatim copy) or not possible (unsupported format).
     */
    SKIPPED,
    FAILED
}
