package com.eyelevel.bulkconverter.service.pipeline;

import com.eyelevel.bulkconverter.config.ConversionProperties;
import com.eyelevel.bulkconverter.converter.DocumentConverter;
import com.eyelevel.bulkconverter.exception.FileConversionException;
import com.eyelevel.bulkconverter.exception.StorageException;
import com.eyelevel.bulkconverter.model.ConversionOutcome;
import com.eyelevel.bulkconverter.model.ErrorKind;
import com.eyelevel.bulkconverter.model.FormatHint;
import com.eyelevel.bulkconverter.model.JobConfig;
import com.eyelevel.bulkconverter.model.WorkItem;
import com.eyelevel.bulkconverter.storage.ObjectStorage;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

/**
 * Converts one work item at a time: download from the source work folder, convert (or copy PDF/TIFF
 * verbatim), upload to the destination output folder, classify.
 * <p>
 * A worker owns its {@link DocumentConverter} and is used by a single thread. Every failure is contained and
 * returned as a {@code Failed} outcome; {@link #process(WorkItem)} never throws for a per-item problem.
 */
@Slf4j
public class ConversionWorker {

    static final String COPIED_REASON = "copied without conversion";
    static final String UNSUPPORTED_REASON = "unsupported format";

    private final ObjectStorage storage;
    private final DocumentConverter converter;
    private final JobConfig jobConfig;
    private final ConversionProperties.Folders folders;

    public ConversionWorker(final ObjectStorage storage, final DocumentConverter converter,
                            final JobConfig jobConfig, final ConversionProperties.Folders folders) {
        this.storage = storage;
        this.converter = converter;
        this.jobConfig = jobConfig;
        this.folders = folders;
    }

    public ConversionOutcome process(final WorkItem item) {
        final String name = item.identifier();
        final FormatHint hint = item.formatHint();
        try {
            if (hint == FormatHint.UNSUPPORTED) {
                log.warn("Skipping '{}': no conversion is available for its extension.", name);
                return ConversionOutcome.skipped(UNSUPPORTED_REASON);
            }

            final byte[] source;
            try {
                source = storage.download(jobConfig.sourceLocation(), folders.work(), name);
            } catch (StorageException e) {
                return fail(item, ErrorKind.DOWNLOAD_FAILED, "Failed to download " + name + " from source", e);
            }

            final byte[] output;
            if (hint.isCopiedVerbatim()) {
                output = source;
            } else {
                try {
                    output = converter.convert(source, hint, name);
                } catch (FileConversionException e) {
                    return fail(item, ErrorKind.CONVERSION_FAILED, "Failed to convert " + name, e);
                }
            }

            final String outputName = outputName(item);
            try {
                storage.upload(jobConfig.destLocation(), folders.output(), outputName, output);
            } catch (StorageException e) {
                return fail(item, ErrorKind.UPLOAD_FAILED,
                            "Failed to upload processed file for " + name + " to destination", e);
            }

            if (hint.isCopiedVerbatim()) {
                log.info("[OK] Copied {} file '{}' as '{}'.", hint, name, outputName);
                return ConversionOutcome.skipped(COPIED_REASON);
            }
            log.info("[OK] Converted and uploaded '{}' as '{}'.", name, outputName);
            return ConversionOutcome.success(output.length);
        } catch (RuntimeException e) {
            return fail(item, ErrorKind.PROCESSING_ERROR, "Error processing document " + name, e);
        }
    }

    /**
     * Converted files take a {@code .pdf} extension; verbatim copies keep their original name.
     */
    static String outputName(final WorkItem item) {
        final String fileName = FilenameUtils.getName(item.identifier());
        return item.formatHint().isCopiedVerbatim() ? fileName : FilenameUtils.getBaseName(fileName) + ".pdf";
    }

    private ConversionOutcome fail(final WorkItem item, final ErrorKind kind, final String summary,
                                   final Exception cause) {
        final String message = summary + ": " + cause.getMessage();
        log.error("[FAILED] {} ({})", message, kind);
        log.debug("Failure detail for '{}'", item.identifier(), cause);
        return ConversionOutcome.failed(kind, message, 1);
    }
}
