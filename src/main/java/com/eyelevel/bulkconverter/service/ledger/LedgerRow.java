package com.eyelevel.bulkconverter.service.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The on-disk shape of one ledger row. Every column is kept as text so that rows written by older versions
 * (or edited by hand) survive a rewrite untouched even when they no longer parse.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"timestamp", "filename", "file_size_bytes", "error_type", "error_message", "attempt_count"})
class LedgerRow {

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("filename")
    private String filename;

    @JsonProperty("file_size_bytes")
    private String fileSizeBytes;

    @JsonProperty("error_type")
    private String errorType;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("attempt_count")
    private String attemptCount;
}
