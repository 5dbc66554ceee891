package com.eyelevel.bulkconverter.service.job;

import com.eyelevel.bulkconverter.exception.MalformedLocationException;
import com.eyelevel.bulkconverter.model.JobConfig;
import com.eyelevel.bulkconverter.model.LocationDescriptor;
import com.eyelevel.bulkconverter.service.location.LocationResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns the content of a trigger artifact into the {@link JobConfig} of one job.
 * <p>
 * The content is a sequence of {@code key:value} lines. {@value #SOURCE_KEY} and {@value #DEST_KEY} override
 * the source and destination locations; every other key is ignored. A side without an override uses the
 * main location, so an empty trigger yields a fully static configuration.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobConfigurationLoader {

    public static final String SOURCE_KEY = "source_sas_url";
    public static final String DEST_KEY = "dest_sas_url";

    private final LocationResolver locationResolver;

    /**
     * @param mainLocation   The statically configured location.
     * @param triggerContent The trigger artifact's text. May be {@code null} or blank.
     * @return The job's configuration.
     * @throws MalformedLocationException if an override is present but cannot be resolved.
     */
    public JobConfig load(final LocationDescriptor mainLocation, final String triggerContent) {
        final Map<String, String> entries = parse(triggerContent);

        final LocationDescriptor source = resolveOverride(entries.get(SOURCE_KEY), SOURCE_KEY, mainLocation);
        final LocationDescriptor destination = resolveOverride(entries.get(DEST_KEY), DEST_KEY, mainLocation);
        final JobConfig jobConfig = new JobConfig(mainLocation, source, destination);

        if (jobConfig.isDynamic()) {
            log.info("Trigger supplied a dynamic configuration. Source: {}, Destination: {}", source.describe(),
                     destination.describe());
        } else {
            log.info("Trigger carries no location overrides. Using the main location {} for source and destination.",
                     mainLocation.describe());
        }
        return jobConfig;
    }

    /**
     * Parses {@code key:value} lines. Values are split at the first colon only since they are URLs.
     * Keys are trimmed and lower-cased; blank lines and {@code #} comments are skipped.
     */
    static Map<String, String> parse(final String content) {
        final Map<String, String> entries = new HashMap<>();
        if (!StringUtils.hasText(content)) {
            return entries;
        }
        for (String rawLine : content.split("\\R")) {
            final String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            final int separator = line.indexOf(':');
            if (separator <= 0) {
                log.debug("Ignoring trigger line without a key: '{}'", line);
                continue;
            }
            final String key = line.substring(0, separator).strip().toLowerCase(Locale.ROOT);
            final String value = line.substring(separator + 1).strip();
            entries.put(key, value);
        }
        return entries;
    }

    private LocationDescriptor resolveOverride(final String rawValue, final String key,
                                               final LocationDescriptor mainLocation) {
        if (!StringUtils.hasText(rawValue)) {
            return mainLocation;
        }
        try {
            return locationResolver.resolve(rawValue);
        } catch (MalformedLocationException e) {
            throw new MalformedLocationException("Trigger key '" + key + "' is malformed: " + e.getMessage(), e);
        }
    }
}
