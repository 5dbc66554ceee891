package com.eyelevel.bulkconverter.storage;

import com.eyelevel.bulkconverter.exception.ObjectNotFoundException;
import com.eyelevel.bulkconverter.exception.StorageException;
import com.eyelevel.bulkconverter.exception.TransientStorageException;
import com.eyelevel.bulkconverter.model.LocationDescriptor;
import com.eyelevel.bulkconverter.model.StoredObject;

import java.util.List;

/**
 * The object-store transport consumed by the orchestration core. Implementations must be safe to call
 * from several worker threads at once; any pooling, retry and timeout policy lives behind this interface.
 * <p>
 * Folders are the logical names ({@code config}, {@code files}, ...) and are placed under the location's
 * path prefix by the implementation.
 */
public interface ObjectStorage {

    /**
     * Lists the objects directly inside {@code folder}. Names are returned relative to the folder.
     *
     * @throws StorageException if the folder cannot be listed.
     */
    List<StoredObject> list(LocationDescriptor location, String folder);

    /**
     * Reads an object fully into memory.
     *
     * @throws ObjectNotFoundException   if the object does not exist.
     * @throws TransientStorageException if the call failed after the transport's retries.
     */
    byte[] download(LocationDescriptor location, String folder, String name);

    /**
     * Writes (or overwrites) an object.
     *
     * @throws TransientStorageException if the call failed after the transport's retries.
     */
    void upload(LocationDescriptor location, String folder, String name, byte[] content);

    /**
     * Deletes an object. Deleting a missing object is not an error.
     */
    void delete(LocationDescriptor location, String folder, String name);
}
