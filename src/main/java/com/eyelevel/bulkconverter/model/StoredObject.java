package com.eyelevel.bulkconverter.model;

/**
 * An entry of an object-store folder listing.
 *
 * @param name      The object name relative to the listed folder.
 * @param sizeBytes The object's content length.
 */
public record StoredObject(String name, long sizeBytes) {
}
