package com.eyelevel.bulkconverter.support;

import com.eyelevel.bulkconverter.config.ConversionProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Factory of {@link ConversionProperties} with the production defaults and no pacing delay.
 */
public final class TestProperties {

    public static final String MAIN_LOCATION = "https://store.example.com/main?sv=token";

    private TestProperties() {
    }

    public static ConversionProperties defaults() {
        return processing(true, 10, 4, true, 1000);
    }

    public static ConversionProperties processing(boolean concurrency, int maxWorkers, int minItemsForConcurrency,
                                                  boolean batching, int batchSize) {
        return new ConversionProperties(
                MAIN_LOCATION,
                new ConversionProperties.Folders("config", "files", "converted", "job_status"),
                new ConversionProperties.Trigger(true, "start_conversion_1234.txt", ".txt"),
                new ConversionProperties.Processing(concurrency, maxWorkers, minItemsForConcurrency, batching,
                                                    batchSize, Duration.ZERO, Path.of("target", "tmp")),
                new ConversionProperties.Ledger(Path.of("target", "failed_conversions.csv"), Duration.ofHours(24)),
                new ConversionProperties.Transport(10, 3, Duration.ofSeconds(30)));
    }
}
