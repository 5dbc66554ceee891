package com.eyelevel.bulkconverter.controller;

import com.eyelevel.bulkconverter.model.ErrorKind;
import com.eyelevel.bulkconverter.model.FailureRecord;
import com.eyelevel.bulkconverter.service.ledger.FailureLedger;
import com.eyelevel.bulkconverter.service.ledger.FailureQuery;
import com.eyelevel.bulkconverter.service.ledger.FailureSummary;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(FailureLedgerController.class)
class FailureLedgerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FailureLedger failureLedger;

    @Test
    void summaryIsWrappedInApiResponse() throws Exception {
        when(failureLedger.summarize()).thenReturn(
                new FailureSummary(3, 2, Map.of("CONVERSION_FAILED", 2L, "UPLOAD_FAILED", 1L), 1, Duration.ofHours(24)));

        mockMvc.perform(get("/failures/v1/summary"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.statusCode").value(200))
               .andExpect(jsonPath("$.response.totalFailures").value(3))
               .andExpect(jsonPath("$.response.uniqueFiles").value(2))
               .andExpect(jsonPath("$.response.byErrorKind.CONVERSION_FAILED").value(2))
               .andExpect(jsonPath("$.response.recentFailures").value(1));
    }

    @Test
    void listingPassesTheFiltersToTheLedger() throws Exception {
        FailureRecord record = new FailureRecord(LocalDateTime.of(2026, 10, 19, 9, 0), "a.docx", 42,
                                                 ErrorKind.DOWNLOAD_FAILED, "Failed to download a.docx", 1);
        FailureQuery expected = new FailureQuery(ErrorKind.DOWNLOAD_FAILED, "a.docx", Duration.ofHours(12));
        when(failureLedger.query(expected)).thenReturn(List.of(record));

        mockMvc.perform(get("/failures/v1").param("errorKind", "DOWNLOAD_FAILED")
                                           .param("filename", "a.docx")
                                           .param("sinceHours", "12"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.displayMessage").value("Found 1 failure record(s)."))
               .andExpect(jsonPath("$.response[0].filename").value("a.docx"))
               .andExpect(jsonPath("$.response[0].errorType").value("DOWNLOAD_FAILED"))
               .andExpect(jsonPath("$.response[0].fileSizeBytes").value(42));
    }

    @Test
    void unknownErrorKindIsABadRequest() throws Exception {
        mockMvc.perform(get("/failures/v1").param("errorKind", "EXPLODED"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.displayMessage").value("Invalid parameter type provided."));

        verifyNoInteractions(failureLedger);
    }

    @Test
    void exportReturnsACsvAttachment() throws Exception {
        String csv = "timestamp,filename,file_size_bytes,error_type,error_message,attempt_count\n"
                     + "2026-10-19T09:00,a.docx,42,UPLOAD_FAILED,boom,1\n";
        doAnswer(invocation -> {
            OutputStream out = invocation.getArgument(1);
            out.write(csv.getBytes(StandardCharsets.UTF_8));
            return 1;
        }).when(failureLedger).export(eq(FailureQuery.ofKind(ErrorKind.UPLOAD_FAILED)), any(OutputStream.class));

        mockMvc.perform(get("/failures/v1/export").param("errorKind", "UPLOAD_FAILED"))
               .andExpect(status().isOk())
               .andExpect(header().string("Content-Disposition",
                                          "attachment; filename=\"" + FailureLedgerController.EXPORT_FILE_NAME + "\""))
               .andExpect(content().contentTypeCompatibleWith("text/csv"))
               .andExpect(content().string(csv));
    }

    @Test
    void pruneDefaultsToThirtyDays() throws Exception {
        when(failureLedger.prune(Duration.ofDays(30))).thenReturn(5);

        mockMvc.perform(delete("/failures/v1"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.removedRecords").value(5))
               .andExpect(jsonPath("$.response.olderThanDays").value(30));

        verify(failureLedger).prune(Duration.ofDays(30));
    }

    @Test
    void nonPositiveRetentionIsRejected() throws Exception {
        mockMvc.perform(delete("/failures/v1").param("olderThanDays", "0"))
               .andExpect(status().isBadRequest());

        verifyNoInteractions(failureLedger);
    }
}
