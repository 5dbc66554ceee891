package com.eyelevel.bulkconverter.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Binds application properties under the "app.conversion" prefix to a single immutable configuration value.
 * It is bound once at startup and handed to every component that needs polling, batching, pooling or
 * ledger settings.
 *
 * @param mainLocation The raw descriptor (URL plus access token) of the statically configured location.
 */
@Validated
@ConfigurationProperties(prefix = "app.conversion")
public record ConversionProperties(@NotBlank String mainLocation,
                                   @Valid @DefaultValue Folders folders,
                                   @Valid @DefaultValue Trigger trigger,
                                   @Valid @DefaultValue Processing processing,
                                   @Valid @DefaultValue Ledger ledger,
                                   @Valid @DefaultValue Transport transport) {

    /**
     * Folder names created under every resolved location.
     */
    public record Folders(@DefaultValue("config") @NotBlank String control,
                          @DefaultValue("files") @NotBlank String work,
                          @DefaultValue("converted") @NotBlank String output,
                          @DefaultValue("job_status") @NotBlank String status) {
    }

    /**
     * @param fileName        The literal trigger artifact name looked for first.
     * @param extension       Fallback: any control-folder object with this extension is a trigger.
     */
    public record Trigger(@DefaultValue("true") boolean enabled,
                          @DefaultValue("start_conversion_1234.txt") @NotBlank String fileName,
                          @DefaultValue(".txt") String extension) {
    }

    /**
     * @param minItemsForConcurrency Batches smaller than this are processed sequentially.
     * @param batchDelay             Pause enforced between two batches of the same job.
     * @param tempDir                Parent directory of the per-item scratch directories.
     */
    public record Processing(@DefaultValue("true") boolean enableConcurrency,
                             @DefaultValue("10") @Min(1) int maxWorkers,
                             @DefaultValue("4") @Min(1) int minItemsForConcurrency,
                             @DefaultValue("true") boolean enableBatching,
                             @DefaultValue("1000") @Min(1) int batchSize,
                             @DefaultValue("5s") Duration batchDelay,
                             @DefaultValue("tmp/bulk-converter") Path tempDir) {
    }

    /**
     * @param path         Location of the failure ledger CSV file.
     * @param recentWindow Window used by the "recent failures" counter of the ledger summary.
     */
    public record Ledger(@DefaultValue("failed_conversions.csv") Path path,
                         @DefaultValue("24h") Duration recentWindow) {
    }

    /**
     * Settings of the pooled network client shared read-only by all workers.
     *
     * @param poolSize   Maximum number of pooled connections.
     * @param maxRetries Transport-level retries per call.
     * @param timeout    Connection and per-call timeout.
     */
    public record Transport(@DefaultValue("10") @Min(1) int poolSize,
                            @DefaultValue("3") @Min(0) int maxRetries,
                            @DefaultValue("30s") Duration timeout) {
    }
}
