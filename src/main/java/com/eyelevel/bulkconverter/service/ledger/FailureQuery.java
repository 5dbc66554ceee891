package com.eyelevel.bulkconverter.service.ledger;

import com.eyelevel.bulkconverter.model.ErrorKind;
import com.eyelevel.bulkconverter.model.FailureRecord;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Filter applied to ledger rows. Every {@code null} criterion matches all rows.
 *
 * @param errorKind Only rows of this kind.
 * @param filename  Only rows for this identifier.
 * @param since     Only rows younger than this.
 */
public record FailureQuery(ErrorKind errorKind, String filename, Duration since) {

    public static FailureQuery all() {
        return new FailureQuery(null, null, null);
    }

    public static FailureQuery ofKind(ErrorKind errorKind) {
        return new FailureQuery(errorKind, null, null);
    }

    public static FailureQuery recent(Duration since) {
        return new FailureQuery(null, null, since);
    }

    boolean matches(FailureRecord record, LocalDateTime now) {
        if (errorKind != null && record.errorKind() != errorKind) {
            return false;
        }
        if (filename != null && !filename.equals(record.identifier())) {
            return false;
        }
        return since == null || !record.timestamp().isBefore(now.minus(since));
    }
}
