package com.eyelevel.bulkconverter.model;

/**
 * One document discovered in a source location's work folder.
 *
 * @param identifier The object name relative to the work folder.
 * @param sizeBytes  The size reported by the listing.
 * @param formatHint The format derived from the name's extension.
 */
public record WorkItem(String identifier, long sizeBytes, FormatHint formatHint) {

    public static WorkItem of(String identifier, long sizeBytes) {
        return new WorkItem(identifier, sizeBytes, FormatHint.fromFileName(identifier));
    }
}
