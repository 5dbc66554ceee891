package com.eyelevel.bulkconverter.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Objects;

/**
 * The result of one attempt at a work item. Exactly one of the status-specific fields is meaningful:
 * {@code outputBytes} for {@link OutcomeStatus#SUCCESS}, {@code reason} for {@link OutcomeStatus#SKIPPED},
 * {@code errorKind}/{@code message}/{@code attempt} for {@link OutcomeStatus#FAILED}.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ConversionOutcome {

    private final OutcomeStatus status;
    private final long outputBytes;
    private final String reason;
    private final ErrorKind errorKind;
    private final String message;
    private final int attempt;

    public static ConversionOutcome success(long outputBytes) {
        return new ConversionOutcome(OutcomeStatus.SUCCESS, outputBytes, null, null, null, 0);
    }

    public static ConversionOutcome skipped(String reason) {
        return new ConversionOutcome(OutcomeStatus.SKIPPED, 0, reason, null, null, 0);
    }

    public static ConversionOutcome failed(ErrorKind errorKind, String message, int attempt) {
        return new ConversionOutcome(OutcomeStatus.FAILED, 0, null, Objects.requireNonNull(errorKind), message,
                                     attempt);
    }

    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCESS;
    }

    public boolean isSkipped() {
        return status == OutcomeStatus.SKIPPED;
    }

    public boolean isFailed() {
        return status == OutcomeStatus.FAILED;
    }

    @Override
    public String toString() {
        return switch (status) {
            case SUCCESS -> "Success{" + outputBytes + " bytes}";
            case SKIPPED -> "Skipped{" + reason + "}";
            case FAILED -> "Failed{" + errorKind + ", attempt " + attempt + ": " + message + "}";
        };
    }
}
