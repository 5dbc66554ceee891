package com.eyelevel.bulkconverter.model;

/**
 * States of the trigger monitor's control loop.
 */
public enum MonitorState {
    IDLE,
    POLLING,
    TRIGGER_FOUND,
    RUNNING_JOB
}
