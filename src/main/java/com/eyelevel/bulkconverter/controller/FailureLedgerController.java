package com.eyelevel.bulkconverter.controller;

import com.eyelevel.bulkconverter.dto.common.ApiResponse;
import com.eyelevel.bulkconverter.dto.failure.FailureRecordResponse;
import com.eyelevel.bulkconverter.dto.failure.PruneResponse;
import com.eyelevel.bulkconverter.model.ErrorKind;
import com.eyelevel.bulkconverter.service.ledger.FailureLedger;
import com.eyelevel.bulkconverter.service.ledger.FailureQuery;
import com.eyelevel.bulkconverter.service.ledger.FailureSummary;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * REST controller for inspecting and maintaining the failure ledger.
 * All JSON responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/failures")
@RequiredArgsConstructor
@Validated
public class FailureLedgerController implements FailureLedgerApi {

    static final String EXPORT_FILE_NAME = "failed_conversions_export.csv";

    private final FailureLedger failureLedger;

    @Override
    @GetMapping("/v1/summary")
    public ResponseEntity<ApiResponse<FailureSummary>> getSummary() {
        log.info("Fetching failure ledger summary.");
        final FailureSummary summary = failureLedger.summarize();
        return ResponseEntity.ok(ApiResponse.success(summary, "Failure summary retrieved successfully."));
    }

    @Override
    @GetMapping("/v1")
    public ResponseEntity<ApiResponse<List<FailureRecordResponse>>> listFailures(
            @RequestParam(value = "errorKind", required = false) final ErrorKind errorKind,
            @RequestParam(value = "filename", required = false) final String filename,
            @RequestParam(value = "sinceHours", required = false) @Positive(message = "The 'sinceHours' must be a positive number.") final Integer sinceHours) {

        log.info("Listing failures. errorKind: {}, filename: {}, sinceHours: {}", errorKind, filename, sinceHours);
        final List<FailureRecordResponse> failures = failureLedger.query(toQuery(errorKind, filename, sinceHours))
                                                                  .stream()
                                                                  .map(FailureRecordResponse::from)
                                                                  .toList();
        return ResponseEntity.ok(ApiResponse.success(failures, "Found " + failures.size() + " failure record(s)."));
    }

    @Override
    @GetMapping("/v1/export")
    public ResponseEntity<byte[]> exportFailures(
            @RequestParam(value = "errorKind", required = false) final ErrorKind errorKind,
            @RequestParam(value = "filename", required = false) final String filename,
            @RequestParam(value = "sinceHours", required = false) @Positive(message = "The 'sinceHours' must be a positive number.") final Integer sinceHours) {

        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        final int exported;
        try {
            exported = failureLedger.export(toQuery(errorKind, filename, sinceHours), out);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to export the failure ledger.", e);
        }
        log.info("Exported {} failure record(s).", exported);

        return ResponseEntity.ok()
                             .contentType(MediaType.parseMediaType("text/csv"))
                             .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                                                                                        .filename(EXPORT_FILE_NAME)
                                                                                        .build()
                                                                                        .toString())
                             .body(out.toByteArray());
    }

    @Override
    @DeleteMapping("/v1")
    public ResponseEntity<ApiResponse<PruneResponse>> pruneFailures(
            @RequestParam(value = "olderThanDays", defaultValue = "30") @Positive(message = "The 'olderThanDays' must be a positive number.") final int olderThanDays) {

        log.warn("Received request to prune failure records older than {} day(s).", olderThanDays);
        final int removed = failureLedger.prune(Duration.ofDays(olderThanDays));
        return ResponseEntity.ok(ApiResponse.success(new PruneResponse(removed, olderThanDays),
                                                     String.format("Removed %d failure record(s) older than %d day(s).",
                                                                   removed, olderThanDays)));
    }

    private static FailureQuery toQuery(final ErrorKind errorKind, final String filename, final Integer sinceHours) {
        return new FailureQuery(errorKind, filename, sinceHours == null ? null : Duration.ofHours(sinceHours));
    }
}
