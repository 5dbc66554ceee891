package com.eyelevel.bulkconverter.model;

/**
 * Pairs a work item with the outcome of its attempt.
 */
public record ItemOutcome(WorkItem item, ConversionOutcome outcome) {
}
