package com.eyelevel.bulkconverter.model;

import org.apache.commons.io.FilenameUtils;

import java.util.Locale;
import java.util.Map;

/**
 * The kind of document a work item holds, derived from its file extension.
 */
public enum FormatHint {
    WORD,
    TEXT,
    HTML,
    IMAGE,
    /**
     * Copied verbatim to the output folder; the original extension is kept.
     */
    TIFF,
    /**
     * Copied verbatim to the output folder.
     */
    PDF,
    UNSUPPORTED;

    private static final Map<String, FormatHint> BY_EXTENSION = Map.ofEntries(
            Map.entry("doc", WORD),
            Map.entry("docx", WORD),
            Map.entry("rtf", WORD),
            Map.entry("odt", WORD),
            Map.entry("txt", TEXT),
            Map.entry("html", HTML),
            Map.entry("htm", HTML),
            Map.entry("jpg", IMAGE),
            Map.entry("jpeg", IMAGE),
            Map.entry("png", IMAGE),
            Map.entry("tif", TIFF),
            Map.entry("tiff", TIFF),
            Map.entry("pdf", PDF));

    public static FormatHint fromFileName(String fileName) {
        String extension = FilenameUtils.getExtension(fileName).toLowerCase(Locale.ROOT);
        return BY_EXTENSION.getOrDefault(extension, UNSUPPORTED);
    }

    /**
     * @return {@code true} when items of this kind are uploaded as-is instead of being converted.
     */
    public boolean isCopiedVerbatim() {
        return this == PDF || this == TIFF;
    }
}
