package com.eyelevel.bulkconverter.model;

/**
 * Classification of a per-item failure. None of these abort the batch.
 */
public enum ErrorKind {
    DOWNLOAD_FAILED,
    CONVERSION_FAILED,
    UPLOAD_FAILED,
    /**
     * Any unexpected exception raised while handling an item.
     */
    PROCESSING_ERROR
}
