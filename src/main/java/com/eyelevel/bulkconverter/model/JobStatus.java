package com.eyelevel.bulkconverter.model;

/**
 * The final state of a job, written to its status log.
 */
public enum JobStatus {
    /**
     * Every discovered item was converted or copied.
     */
    COMPLETED,
    /**
     * Some items failed, others did not.
     */
    PARTIAL_SUCCESS,
    /**
     * Every attempted item failed, or the job aborted before attempting any item.
     */
    FAILED,
    /**
     * The source work folder held nothing to convert.
     */
    NO_WORK
}
