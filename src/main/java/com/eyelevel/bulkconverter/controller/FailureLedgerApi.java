package com.eyelevel.bulkconverter.controller;

import com.eyelevel.bulkconverter.dto.common.ApiResponse;
import com.eyelevel.bulkconverter.dto.failure.FailureRecordResponse;
import com.eyelevel.bulkconverter.dto.failure.PruneResponse;
import com.eyelevel.bulkconverter.model.ErrorKind;
import com.eyelevel.bulkconverter.service.ledger.FailureSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

@Tag(name = "Failure Ledger", description = "Endpoints for inspecting, exporting and pruning the record of failed conversions.")
public interface FailureLedgerApi {

    @Operation(summary = "Summarize Failures",
            description = "Returns the total number of recorded failures, the number of distinct files, a count per error type and the number of failures in the recent window.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Summary computed successfully.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Failure summary retrieved successfully.",
                                        "response": {
                                            "totalFailures": 3,
                                            "uniqueFiles": 2,
                                            "byErrorKind": { "CONVERSION_FAILED": 2, "UPLOAD_FAILED": 1 },
                                            "recentFailures": 1,
                                            "recentWindow": "PT24H"
                                        },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "500", description = "Internal Server Error - The ledger could not be read.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<FailureSummary>> getSummary();

    @Operation(summary = "List Failures",
            description = "Lists recorded failures in the order they were recorded. All filters are optional and combined.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Failures retrieved successfully.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Unknown error type or invalid hours.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<List<FailureRecordResponse>>> listFailures(
            @Parameter(description = "Only failures of this type.", example = "CONVERSION_FAILED")
            @RequestParam(value = "errorKind", required = false) ErrorKind errorKind,
            @Parameter(description = "Only failures of this file.", example = "report.docx")
            @RequestParam(value = "filename", required = false) String filename,
            @Parameter(description = "Only failures recorded within the last N hours.", example = "24")
            @RequestParam(value = "sinceHours", required = false) Integer sinceHours);

    @Operation(summary = "Export Failures as CSV",
            description = "Downloads the matching failures as a CSV file with the ledger's header row.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "CSV file generated.",
                    content = @Content(mediaType = "text/csv")),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Unknown error type or invalid hours.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<byte[]> exportFailures(
            @Parameter(description = "Only failures of this type.", example = "DOWNLOAD_FAILED")
            @RequestParam(value = "errorKind", required = false) ErrorKind errorKind,
            @Parameter(description = "Only failures of this file.")
            @RequestParam(value = "filename", required = false) String filename,
            @Parameter(description = "Only failures recorded within the last N hours.")
            @RequestParam(value = "sinceHours", required = false) Integer sinceHours);

    @Operation(summary = "Prune Old Failures (Admin)",
            description = "**ADMINISTRATIVE ACTION:** Permanently removes failures older than the given number of days. Rows whose timestamp cannot be read are removed as well.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Old failures removed.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Removed 12 failure record(s) older than 30 day(s).",
                                        "response": { "removedRecords": 12, "olderThanDays": 30 },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - olderThanDays is not positive.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<PruneResponse>> pruneFailures(
            @Parameter(description = "Records older than this many days are removed.", example = "30")
            @RequestParam(value = "olderThanDays", defaultValue = "30") int olderThanDays);
}
