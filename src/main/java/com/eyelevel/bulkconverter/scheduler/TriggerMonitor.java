package com.eyelevel.bulkconverter.scheduler;

import com.eyelevel.bulkconverter.config.ConversionProperties;
import com.eyelevel.bulkconverter.exception.MalformedLocationException;
import com.eyelevel.bulkconverter.exception.StorageException;
import com.eyelevel.bulkconverter.model.JobConfig;
import com.eyelevel.bulkconverter.model.JobResult;
import com.eyelevel.bulkconverter.model.LocationDescriptor;
import com.eyelevel.bulkconverter.model.MonitorState;
import com.eyelevel.bulkconverter.model.StoredObject;
import com.eyelevel.bulkconverter.service.job.JobConfigurationLoader;
import com.eyelevel.bulkconverter.service.job.JobRunner;
import com.eyelevel.bulkconverter.service.location.LocationResolver;
import com.eyelevel.bulkconverter.storage.ObjectStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Watches the main location's control folder for a trigger artifact and runs one job per trigger.
 * <p>
 * Polling uses a fixed delay on Spring's single scheduler thread, so the next check starts only after the
 * previous job has finished and its status log has been uploaded; two jobs never overlap.
 */
@Slf4j
@Component
public class TriggerMonitor {

    private final ObjectStorage storage;
    private final LocationResolver locationResolver;
    private final JobConfigurationLoader configurationLoader;
    private final JobRunner jobRunner;
    private final ConversionProperties properties;
    private final AtomicReference<MonitorState> state = new AtomicReference<>(MonitorState.IDLE);

    public TriggerMonitor(final ObjectStorage storage, final LocationResolver locationResolver,
                          final JobConfigurationLoader configurationLoader, final JobRunner jobRunner,
                          final ConversionProperties properties) {
        this.storage = storage;
        this.locationResolver = locationResolver;
        this.configurationLoader = configurationLoader;
        this.jobRunner = jobRunner;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${app.scheduler.trigger-polling-interval:PT120S}",
               initialDelayString = "${app.scheduler.trigger-initial-delay:PT5S}")
    public void poll() {
        if (!properties.trigger().enabled()) {
            log.debug("Trigger monitoring is disabled. Skipping poll.");
            return;
        }
        try {
            pollOnce();
        } catch (Exception e) {
            log.error("Unexpected error while checking for triggers. Polling resumes on the next cycle.", e);
        } finally {
            state.set(MonitorState.IDLE);
        }
    }

    /**
     * Performs a single check of the control folder and, when a trigger is present, runs its job to completion.
     *
     * @return The job's result, or empty when no job ran.
     */
    public Optional<JobResult> pollOnce() {
        state.set(MonitorState.POLLING);
        final LocationDescriptor mainLocation = locationResolver.resolve(properties.mainLocation());
        final String controlFolder = properties.folders().control();

        final List<StoredObject> controlObjects;
        try {
            controlObjects = storage.list(mainLocation, controlFolder);
        } catch (StorageException e) {
            log.warn("Unable to list control folder {}: {}", mainLocation.folderPath(controlFolder), e.getMessage());
            return Optional.empty();
        }

        final Optional<StoredObject> trigger = findTrigger(controlObjects, properties.trigger());
        if (trigger.isEmpty()) {
            log.debug("No trigger in {}.", mainLocation.folderPath(controlFolder));
            return Optional.empty();
        }

        state.set(MonitorState.TRIGGER_FOUND);
        final String triggerName = trigger.get().name();
        log.info("Trigger '{}' detected in {}.", triggerName, mainLocation.folderPath(controlFolder));

        final String content;
        try {
            content = new String(storage.download(mainLocation, controlFolder, triggerName), StandardCharsets.UTF_8);
        } catch (StorageException e) {
            log.warn("Failed to read trigger '{}'. It is left in place for the next poll. Cause: {}", triggerName,
                     e.getMessage());
            return Optional.empty();
        }

        final JobConfig jobConfig;
        try {
            jobConfig = configurationLoader.load(mainLocation, content);
        } catch (MalformedLocationException e) {
            log.error("Trigger '{}' is malformed and will be removed: {}", triggerName, e.getMessage());
            deleteTrigger(mainLocation, triggerName);
            state.set(MonitorState.RUNNING_JOB);
            return Optional.of(jobRunner.runFatal(mainLocation, e.getMessage()));
        }

        deleteTrigger(mainLocation, triggerName);
        state.set(MonitorState.RUNNING_JOB);
        return Optional.of(jobRunner.run(jobConfig));
    }

    public MonitorState getState() {
        return state.get();
    }

    /**
     * The literal trigger name wins; otherwise the alphabetically first object with the trigger extension.
     */
    static Optional<StoredObject> findTrigger(final List<StoredObject> objects,
                                              final ConversionProperties.Trigger trigger) {
        final Optional<StoredObject> literal = objects.stream()
                                                      .filter(object -> object.name().equals(trigger.fileName()))
                                                      .findFirst();
        if (literal.isPresent() || !StringUtils.hasText(trigger.extension())) {
            return literal;
        }
        return objects.stream()
                      .filter(object -> object.name().endsWith(trigger.extension()))
                      .min(Comparator.comparing(StoredObject::name));
    }

    private void deleteTrigger(final LocationDescriptor mainLocation, final String triggerName) {
        try {
            storage.delete(mainLocation, properties.folders().control(), triggerName);
            log.info("Trigger '{}' removed.", triggerName);
        } catch (StorageException e) {
            log.error("Failed to remove trigger '{}'. It may fire again on the next poll.", triggerName, e);
        }
    }
}
