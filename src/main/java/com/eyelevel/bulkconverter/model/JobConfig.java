package com.eyelevel.bulkconverter.model;

/**
 * The resolved locations of one job. Created once per detected trigger and discarded when the job ends.
 *
 * @param mainLocation   The statically configured location that hosts the control folder and status logs.
 * @param sourceLocation Where the work items are read from.
 * @param destLocation   Where converted outputs are written.
 */
public record JobConfig(LocationDescriptor mainLocation,
                        LocationDescriptor sourceLocation,
                        LocationDescriptor destLocation) {

    public static JobConfig staticConfig(LocationDescriptor mainLocation) {
        return new JobConfig(mainLocation, mainLocation, mainLocation);
    }

    /**
     * @return {@code true} when the trigger overrode the source or the destination.
     */
    public boolean isDynamic() {
        return !sourceLocation.equals(mainLocation) || !destLocation.equals(mainLocation);
    }
}
