package com.eyelevel.bulkconverter.dto.failure;

import com.eyelevel.bulkconverter.model.ErrorKind;
import com.eyelevel.bulkconverter.model.FailureRecord;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

@Getter
@Builder
public class FailureRecordResponse {
    private final LocalDateTime timestamp;
    private final String filename;
    private final long fileSizeBytes;
    private final ErrorKind errorType;
    private final String errorMessage;
    private final int attemptCount;

    public static FailureRecordResponse from(final FailureRecord record) {
        return FailureRecordResponse.builder()
                                    .timestamp(record.timestamp())
                                    .filename(record.identifier())
                                    .fileSizeBytes(record.sizeBytes())
                                    .errorType(record.errorKind())
                                    .errorMessage(record.message())
                                    .attemptCount(record.attemptCount())
                                    .build();
    }
}
